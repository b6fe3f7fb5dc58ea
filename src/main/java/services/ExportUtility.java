package services;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

import classes.Header;
import org.apache.commons.lang3.StringUtils;

public class ExportUtility {

	private ExportUtility() {
		super();
	}

	/**
	 * Converts a raw value into its cell representation.
	 * <p>
	 * {@code null} becomes the empty string, anything else its {@link String#valueOf(Object)} text.
	 * This is the conversion used by every exporter that reads untyped values (map entries, annotated fields).
	 * </p>
	 *
	 * @param value the raw value, possibly {@code null}
	 * @return the display string of the value, never {@code null}
	 */
	public static String renderCell(Object value) {
		return value == null ? StringUtils.EMPTY : String.valueOf(value);
	}

	/**
	 * Looks a key up in a map record and renders it with {@link #renderCell(Object)}.
	 * An absent key and a key mapped to {@code null} both render as the empty string.
	 *
	 * @param record the map record
	 * @param key    the key to read
	 * @return the display string of the value
	 */
	public static String renderCell(Map<String, ?> record, String key) {
		return renderCell(record.get(key));
	}

	/**
	 * Permutes the headers according to a soft label preference.
	 * <p>
	 * Labels listed in {@code headerOrder} come first, in the listed order. Headers whose label is not listed
	 * share the key {@code headerOrder.size()} and follow, keeping their declaration order.
	 * When {@code headerOrder} is {@code null} or empty the headers are returned in declaration order.
	 * The result always holds exactly the input headers.
	 * </p>
	 *
	 * @param <T>         the record type of the headers
	 * @param headers     the declared headers
	 * @param headerOrder the preferred label order, may be {@code null}
	 * @return a new list with the headers in display order
	 */
	public static <T> List<Header<T>> sortHeaders(List<Header<T>> headers, List<String> headerOrder) {
		List<Header<T>> sorted = new ArrayList<>(headers);
		if (headerOrder == null || headerOrder.isEmpty()) {
			return sorted;
		}
		// List.sort is a stable merge sort: ties keep declaration order
		sorted.sort(orderComparator(headerOrder));
		return sorted;
	}

	/**
	 * @param <T>         the record type of the headers
	 * @param headerOrder the preferred label order
	 * @return a comparator ordering headers by their position in {@code headerOrder}
	 */
	static <T> Comparator<Header<T>> orderComparator(List<String> headerOrder) {
		return Comparator.comparingInt(header -> orderIndex(headerOrder, header.getLabel()));
	}

	/**
	 * @param headerOrder the preferred label order
	 * @param label       the label to look up
	 * @return the first index of {@code label} in {@code headerOrder}, or its size when absent
	 */
	static int orderIndex(List<String> headerOrder, String label) {
		int index = headerOrder.indexOf(label);
		return index < 0 ? headerOrder.size() : index;
	}

	/**
	 * Retrieves the fields of a record class annotated with {@link ExportColumn}, sorted by
	 * {@link ExportColumn#order()}. Fields sharing an order keep their declaration order.
	 *
	 * @param type the record class
	 * @return the exportable fields
	 */
	public static List<Field> getExportFields(Class<?> type) {
		return Arrays.stream(type.getDeclaredFields())
					 .filter(f -> f.isAnnotationPresent(ExportColumn.class))
					 .sorted(Comparator.comparingInt(f -> f.getAnnotation(ExportColumn.class).order()))
					 .collect(Collectors.toList());
	}

	/**
	 * Resolves the column label of an exportable field: the annotation label, or the field name when blank.
	 *
	 * @param field a field annotated with {@link ExportColumn}
	 * @return the column label
	 */
	public static String getExportLabel(Field field) {
		ExportColumn annotation = field.getAnnotation(ExportColumn.class);
		return StringUtils.defaultIfBlank(annotation == null ? null : annotation.label(), field.getName());
	}

	/**
	 * Reads a field of a record and renders it with {@link #renderCell(Object)}.
	 *
	 * @param field  the field to read
	 * @param entity the record
	 * @return the display string of the field value
	 * @throws RuntimeException if the field cannot be read
	 */
	public static String getFieldValue(Field field, Object entity) {
		Objects.requireNonNull(entity, "record");
		try {
			field.setAccessible(true);
			return renderCell(field.get(entity));
		} catch (IllegalArgumentException | IllegalAccessException e) {
			throw new RuntimeException("Cannot read field " + field.getName() + " of " + entity.getClass().getName(), e);
		}
	}

	//=========================================================================================================
	// ANNOTATIONS
	//=========================================================================================================

	/**
	 * Marks a field of a record class as an export column.
	 *
	 * @see classes.AnnotatedExport
	 */
	@Retention(RetentionPolicy.RUNTIME)
	@Target(ElementType.FIELD)
	public @interface ExportColumn {

		/**
		 * The column label. When blank the field name is used.
		 *
		 * @return the column label
		 */
		String label() default "";

		/**
		 * The declared position of the column. Lower values come first.
		 *
		 * @return the column order
		 */
		int order() default 0;
	}
}
