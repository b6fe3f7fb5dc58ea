package classes;

import java.util.Objects;

import interfaces.CellHandler;

/**
 * Pairs a column label with the {@link CellHandler} that renders the column for one record.
 * <p>
 * Labels are neither validated for emptiness nor for uniqueness: two headers sharing a label
 * produce two columns, each extracted independently.
 * </p>
 *
 * @param <T> the type of record the header reads
 */
public final class Header<T> {

	/**
	 * The column display name, also used as its key in the header order preference.
	 */
	private final String label;

	/**
	 * The extraction function for this column.
	 */
	private final CellHandler<T> handler;

	/**
	 * @param label   the column label
	 * @param handler the extraction function, never {@code null}
	 */
	public Header(String label, CellHandler<T> handler) {
		this.label = label;
		this.handler = Objects.requireNonNull(handler, "handler");
	}

	public static <T> Header<T> of(String label, CellHandler<T> handler) {
		return new Header<>(label, handler);
	}

	public String getLabel() {
		return label;
	}

	public CellHandler<T> getHandler() {
		return handler;
	}

	/**
	 * Applies the handler to a record.
	 *
	 * @param record the record being exported
	 * @return the display value of this column for {@code record}
	 */
	public String extract(T record) {
		return handler.handle(record);
	}

	@Override
	public String toString() {
		return "Header[" + label + "]";
	}
}
