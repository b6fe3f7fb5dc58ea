package interfaces;

/**
 * A functional interface used to extract the display value of one column from a record.
 * <p>
 * Implementations are expected to be pure: they are invoked once per record per export
 * and any exception they throw aborts the export in progress.
 * </p>
 *
 * @param <T> the type of record the handler reads
 */
@FunctionalInterface
public interface CellHandler<T> {

	/**
	 * Renders the cell of this column for the given record.
	 *
	 * @param record the record being exported
	 * @return the display string of the cell
	 */
	String handle(T record);
}
