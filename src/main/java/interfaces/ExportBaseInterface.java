package interfaces;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Base contract shared by every exporter.
 * <p>
 * An export is a sequence of rows, each row an ordered list of display strings.
 * The first row of a single export is the header-label row.
 * </p>
 *
 * <h3>Forms:</h3>
 * <ul>
 *   <li>{@link #rows()} - the lazy form: a forward-only cursor, consumable once.
 *       Calling it again starts a fresh production.</li>
 *   <li>{@link #toList()} - the materialized form, obtained by exhausting {@link #rows()}.</li>
 * </ul>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * Iterator<List<String>> cursor = exporter.rows();
 * while (cursor.hasNext()) {
 *     writer.write(cursor.next());
 * }
 * }</pre>
 */
public interface ExportBaseInterface {

	/**
	 * Starts a new production of this export.
	 * <p>
	 * The returned iterator performs no work beyond what is needed to yield the next row.
	 * Failures raised while computing a row propagate from {@link Iterator#next()};
	 * rows already returned are not retracted.
	 * </p>
	 *
	 * @return a single-use iterator over the rows of this export
	 */
	Iterator<List<String>> rows();

	/**
	 * Materializes this export.
	 *
	 * @return every row of {@link #rows()}, in order
	 */
	default List<List<String>> toList() {
		List<List<String>> rows = new ArrayList<>();
		rows().forEachRemaining(rows::add);
		return rows;
	}
}
