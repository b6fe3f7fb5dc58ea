package interfaces;

import java.util.List;

import classes.Header;

/**
 * Contract for exporters that project records through header bindings.
 * <p>
 * Any class implementing this interface is also an {@link ExportBaseInterface}: its rows are
 * the header labels followed by one row per fetched record.
 * </p>
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * public class OrderExport extends classes.ExportBaseTable<Order> {
 *     protected List<Order> fetchRecords() { return repository.findAll(); }
 * }
 * }</pre>
 *
 * @param <T> the type of record being exported
 */
public interface ExportSimple<T> extends ExportBaseInterface {

	/**
	 * Fetches the records to export. Called once per production.
	 *
	 * @return the records, in export order
	 */
	List<T> fetchRecords();

	/**
	 * @return the declared header bindings, in declaration order
	 */
	List<Header<T>> getHeaders();

	/**
	 * @return the header bindings permuted by the header order preference
	 */
	List<Header<T>> getSortedHeaders();

	/**
	 * @return the labels of {@link #getSortedHeaders()}, in the same order
	 */
	List<String> getHeaderLabels();

	/**
	 * @return the preferred left-to-right label order, or an empty list when none is configured
	 */
	List<String> getHeaderOrder();
}
