package classes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

import interfaces.CellHandler;

/**
 * A record-backed export whose headers are declared by the caller and whose records come
 * from a fixed list or from a {@link Supplier} invoked once per production.
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * ComplexExport<Order> export = ComplexExport.<Order>builder()
 *         .header("id", o -> String.valueOf(o.getId()))
 *         .header("customer", Order::getCustomer)
 *         .headerOrder("customer")
 *         .records(orderRepository::findAll)
 *         .build();
 * }</pre>
 *
 * @param <T> the type of record being exported
 */
public class ComplexExport<T> extends ExportBaseTable<T> {

	/**
	 * The source of the records, {@code null} when none was configured.
	 */
	private final Supplier<List<T>> dati;

	/**
	 * @param headers the declared header bindings
	 * @param dati    the records to export
	 */
	public ComplexExport(List<Header<T>> headers, List<T> dati) {
		this(headers, null, dati);
	}

	/**
	 * @param headers     the declared header bindings
	 * @param headerOrder the preferred label order, may be {@code null}
	 * @param dati        the records to export
	 */
	public ComplexExport(List<Header<T>> headers, List<String> headerOrder, List<T> dati) {
		this(headers, headerOrder, dati == null ? null : fixed(dati));
	}

	/**
	 * @param headers     the declared header bindings
	 * @param headerOrder the preferred label order, may be {@code null}
	 * @param source      the record source, invoked on every production
	 */
	public ComplexExport(List<Header<T>> headers, List<String> headerOrder, Supplier<List<T>> source) {
		super(headers, headerOrder);
		this.dati = source;
	}

	private static <T> Supplier<List<T>> fixed(List<T> dati) {
		List<T> copy = Collections.unmodifiableList(new ArrayList<>(dati));
		return () -> copy;
	}

	/**
	 * @throws IllegalStateException if no record source was configured
	 */
	@Override
	public List<T> fetchRecords() {
		if (dati == null) {
			throw new IllegalStateException("ComplexExport has no record source");
		}
		return dati.get();
	}

	public static <T> Builder<T> builder() {
		return new Builder<>();
	}

	/**
	 * Fluent builder for {@link ComplexExport}.
	 *
	 * @param <T> the type of record being exported
	 */
	public static final class Builder<T> {

		private final List<Header<T>> headers = new ArrayList<>();
		private List<String> headerOrder;
		private Supplier<List<T>> source;

		private Builder() {
			super();
		}

		/**
		 * Declares a column.
		 *
		 * @param label   the column label
		 * @param handler the extraction function
		 * @return this builder
		 */
		public Builder<T> header(String label, CellHandler<T> handler) {
			headers.add(new Header<>(label, handler));
			return this;
		}

		/**
		 * Declares already built columns.
		 *
		 * @param headers the header bindings to append
		 * @return this builder
		 */
		@SafeVarargs
		public final Builder<T> headers(Header<T>... headers) {
			this.headers.addAll(Arrays.asList(headers));
			return this;
		}

		/**
		 * Sets the preferred label order.
		 *
		 * @param labels the labels to place first, in order
		 * @return this builder
		 */
		public Builder<T> headerOrder(String... labels) {
			this.headerOrder = Arrays.asList(labels);
			return this;
		}

		public Builder<T> headerOrder(List<String> labels) {
			this.headerOrder = labels;
			return this;
		}

		/**
		 * @param dati a fixed list of records
		 * @return this builder
		 */
		public Builder<T> records(List<T> dati) {
			this.source = dati == null ? null : fixed(dati);
			return this;
		}

		/**
		 * @param source a record source invoked on every production
		 * @return this builder
		 */
		public Builder<T> records(Supplier<List<T>> source) {
			this.source = source;
			return this;
		}

		public ComplexExport<T> build() {
			return new ComplexExport<>(headers, headerOrder, source);
		}
	}
}
