package classes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

import interfaces.ExportBaseInterface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Concatenates the exports of several sections into one.
 * <p>
 * The rows of each section are emitted in list order, with exactly one empty row between two consecutive
 * sections. Separators are placed by position in the list, so the same exporter may appear more than once.
 * An empty report has no rows at all.
 * </p>
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * ReportExport report = new ReportExport(ordersExport, totalsExport);
 * ExportCsv.writeCsv(report, out, settings);
 * }</pre>
 *
 * @see ExportBaseInterface
 */
public class ReportExport implements ExportBaseInterface {

	private static final Logger log = LoggerFactory.getLogger(ReportExport.class);

	/**
	 * The separator row placed between two sections.
	 */
	static final List<String> SEPARATOR = Collections.emptyList();

	private final List<ExportBaseInterface> data;

	public ReportExport(ExportBaseInterface... data) {
		this(Arrays.asList(data));
	}

	/**
	 * @param data the sections, in output order
	 */
	public ReportExport(List<? extends ExportBaseInterface> data) {
		this.data = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(data, "data")));
	}

	public List<ExportBaseInterface> getData() {
		return data;
	}

	@Override
	public Iterator<List<String>> rows() {
		log.debug("Report export started: {} sections", data.size());
		return new SectionRowIterator(data);
	}

	/**
	 * Walks the sections, starting each one only when the previous one is exhausted.
	 */
	private static final class SectionRowIterator implements Iterator<List<String>> {

		private final List<ExportBaseInterface> sections;
		private int index = -1;
		private Iterator<List<String>> current = Collections.emptyIterator();
		private boolean separatorPending;
		private boolean separatorEmitted;

		private SectionRowIterator(List<ExportBaseInterface> sections) {
			this.sections = sections;
		}

		@Override
		public boolean hasNext() {
			while (!separatorPending && !current.hasNext()) {
				if (index + 1 >= sections.size()) {
					return false;
				}
				// the separator goes out before the next section is started
				if (index >= 0 && !separatorEmitted) {
					separatorPending = true;
					separatorEmitted = true;
					return true;
				}
				index++;
				separatorEmitted = false;
				log.debug("Report section {} of {}", index + 1, sections.size());
				current = sections.get(index).rows();
			}
			return true;
		}

		@Override
		public List<String> next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			if (separatorPending) {
				separatorPending = false;
				return SEPARATOR;
			}
			return current.next();
		}
	}
}
