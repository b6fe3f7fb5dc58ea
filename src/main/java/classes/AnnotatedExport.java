package classes;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import services.ExportUtility;
import services.ExportUtility.ExportColumn;

/**
 * Exports typed records whose class marks its columns with {@link ExportColumn}.
 * <p>
 * Columns are declared in {@link ExportColumn#order()} order; the header order preference is then applied
 * to the resolved labels like for any other {@link ExportBaseTable}.
 * </p>
 *
 * <h3>Usage:</h3>
 * <pre>
 * public class Invoice {
 *     &#64;ExportColumn(label = "Number", order = 1)
 *     private String number;
 *     &#64;ExportColumn(label = "Total", order = 2)
 *     private BigDecimal total;
 * }
 *
 * new AnnotatedExport&lt;&gt;(Invoice.class, invoices).toList();
 * </pre>
 *
 * @param <T> the type of record being exported
 */
public class AnnotatedExport<T> extends ExportBaseTable<T> {

	private final Class<T> type;
	private final List<T> dati;

	public AnnotatedExport(Class<T> type, List<T> dati) {
		this(type, dati, null);
	}

	/**
	 * @param type        the record class carrying the {@link ExportColumn} annotations
	 * @param dati        the records
	 * @param headerOrder the preferred label order, may be {@code null}
	 */
	public AnnotatedExport(Class<T> type, List<T> dati, List<String> headerOrder) {
		super(headerOrder);
		this.type = Objects.requireNonNull(type, "type");
		this.dati = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(dati, "dati")));
	}

	public Class<T> getType() {
		return type;
	}

	@Override
	public List<T> fetchRecords() {
		return dati;
	}

	@Override
	public List<Header<T>> getHeaders() {
		return ExportUtility.getExportFields(type).stream()
							.map(AnnotatedExport::<T>fieldHeader)
							.collect(Collectors.toList());
	}

	private static <T> Header<T> fieldHeader(Field field) {
		return new Header<>(ExportUtility.getExportLabel(field), record -> ExportUtility.getFieldValue(field, record));
	}
}
