package classes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

import interfaces.ExportSimple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import services.ExportUtility;

/**
 * An abstract base class for exporters that project records through {@link Header} bindings.
 * Implements {@link ExportSimple} and provides the header ordering and the row production
 * shared by every record-backed export.
 * <p>
 * Subclasses supply {@link #fetchRecords()} and either pass their headers to the constructor
 * or override {@link #getHeaders()} to derive them.
 * </p>
 *
 * @param <T> the type of record being exported
 */
public abstract class ExportBaseTable<T> implements ExportSimple<T> {

	private static final Logger log = LoggerFactory.getLogger(ExportBaseTable.class);

	/**
	 * The declared header bindings. {@code null} when the subclass derives them.
	 */
	private final List<Header<T>> headers;

	/**
	 * The preferred left-to-right label order. Empty when none is configured.
	 */
	private final List<String> headerOrder;

	/**
	 * Constructor for subclasses that override {@link #getHeaders()}.
	 *
	 * @param headerOrder the preferred label order, may be {@code null}
	 */
	protected ExportBaseTable(List<String> headerOrder) {
		this(null, headerOrder);
	}

	/**
	 * @param headers     the declared header bindings, copied
	 * @param headerOrder the preferred label order, may be {@code null}
	 */
	protected ExportBaseTable(List<Header<T>> headers, List<String> headerOrder) {
		super();
		this.headers = headers == null ? null : Collections.unmodifiableList(new ArrayList<>(headers));
		this.headerOrder = headerOrder == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(headerOrder));
	}

	@Override
	public abstract List<T> fetchRecords();

	@Override
	public List<Header<T>> getHeaders() {
		return headers;
	}

	@Override
	public List<String> getHeaderOrder() {
		return headerOrder;
	}

	@Override
	public List<Header<T>> getSortedHeaders() {
		return ExportUtility.sortHeaders(requireHeaders(), getHeaderOrder());
	}

	@Override
	public List<String> getHeaderLabels() {
		return labelsOf(getSortedHeaders());
	}

	/**
	 * Starts a production: validates the headers, sorts them once and fetches the records.
	 * Each record is converted only when its row is requested.
	 *
	 * @return a single-use iterator over the header row and one row per record
	 * @throws IllegalStateException if no header bindings are declared or the record source yields {@code null}
	 */
	@Override
	public Iterator<List<String>> rows() {
		List<Header<T>> sortedHeaders = getSortedHeaders();
		List<T> records = fetchRecords();
		if (records == null) {
			throw new IllegalStateException(getClass().getSimpleName() + " fetched no record list");
		}
		log.debug("Export {} started: {} columns, {} records", getClass().getSimpleName(), sortedHeaders.size(), records.size());
		return new RecordRowIterator<>(sortedHeaders, records.iterator());
	}

	private List<Header<T>> requireHeaders() {
		List<Header<T>> declared = getHeaders();
		if (declared == null) {
			throw new IllegalStateException(getClass().getSimpleName() + " declares no header bindings");
		}
		return declared;
	}

	private static <T> List<String> labelsOf(List<Header<T>> headers) {
		return headers.stream().map(Header::getLabel).collect(Collectors.toList());
	}

	/**
	 * Yields the label row, then one row per record.
	 */
	private static final class RecordRowIterator<T> implements Iterator<List<String>> {

		private final List<Header<T>> headers;
		private final Iterator<T> records;
		private boolean headerEmitted;

		private RecordRowIterator(List<Header<T>> headers, Iterator<T> records) {
			this.headers = headers;
			this.records = records;
		}

		@Override
		public boolean hasNext() {
			return !headerEmitted || records.hasNext();
		}

		@Override
		public List<String> next() {
			if (!headerEmitted) {
				headerEmitted = true;
				return Collections.unmodifiableList(labelsOf(headers));
			}
			if (!records.hasNext()) {
				throw new NoSuchElementException();
			}
			T record = records.next();
			List<String> row = new ArrayList<>(headers.size());
			for (Header<T> header : headers) {
				row.add(header.extract(record));
			}
			return Collections.unmodifiableList(row);
		}
	}
}
