package classes;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import services.ExportUtility;

/**
 * Exports map records keyed by a flat list of field names.
 * <p>
 * Each field name is both the map key read and the column label. An absent key or a {@code null}
 * value renders as the empty string (see {@link ExportUtility#renderCell(Object)}). Field names are
 * not deduplicated: a repeated name produces a repeated column.
 * </p>
 */
public class SimpleExport extends ExportBaseTable<Map<String, ?>> {

	private final List<String> fields;
	private final List<Map<String, ?>> dati;

	public SimpleExport(List<String> fields, List<? extends Map<String, ?>> dati) {
		this(fields, dati, null);
	}

	/**
	 * @param fields      the map keys to export, also used as labels
	 * @param dati        the records
	 * @param headerOrder the preferred field order, may be {@code null}
	 */
	public SimpleExport(List<String> fields, List<? extends Map<String, ?>> dati, List<String> headerOrder) {
		super(headerOrder);
		this.fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
		this.dati = List.copyOf(Objects.requireNonNull(dati, "dati"));
	}

	public List<String> getFields() {
		return fields;
	}

	@Override
	public List<Map<String, ?>> fetchRecords() {
		return dati;
	}

	/**
	 * Derives one header per field name.
	 */
	@Override
	public List<Header<Map<String, ?>>> getHeaders() {
		return fields.stream()
					 .map(SimpleExport::fieldHeader)
					 .collect(Collectors.toList());
	}

	private static Header<Map<String, ?>> fieldHeader(String field) {
		return new Header<>(field, record -> ExportUtility.renderCell(record, field));
	}
}
