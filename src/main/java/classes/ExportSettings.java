package classes;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import enums.ExportFormat;
import org.apache.commons.lang3.EnumUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivery settings handed to the writers together with an export.
 * <p>
 * The filename hint and the content type label are forwarded as configured, without interpretation.
 * Instances are immutable; the {@code with*} methods return modified copies.
 * </p>
 *
 * <h3>Properties ({@value #DEFAULT_RESOURCE}):</h3>
 * <ul>
 *   <li>{@code export.filename} - filename hint, without extension (default {@value #DEFAULT_FILENAME})</li>
 *   <li>{@code export.contentType} - content type label (default: the format's)</li>
 *   <li>{@code export.delimiter} - CSV delimiter, a single character (default {@code ,})</li>
 *   <li>{@code export.format} - {@code CSV} or {@code XLSX} (default {@code CSV})</li>
 * </ul>
 */
public final class ExportSettings {

	private static final Logger log = LoggerFactory.getLogger(ExportSettings.class);

	public static final String DEFAULT_RESOURCE = "export.properties";
	public static final String DEFAULT_FILENAME = "export";
	public static final char DEFAULT_DELIMITER = ',';

	private final String filename;
	private final String contentType;
	private final char delimiter;
	private final ExportFormat format;

	private ExportSettings(String filename, String contentType, char delimiter, ExportFormat format) {
		this.filename = filename;
		this.contentType = contentType;
		this.delimiter = delimiter;
		this.format = format;
	}

	/**
	 * @return CSV settings with the {@value #DEFAULT_FILENAME} filename and the {@code text/csv} content type
	 */
	public static ExportSettings defaults() {
		return new ExportSettings(DEFAULT_FILENAME, ExportFormat.CSV.getContentType(), DEFAULT_DELIMITER, ExportFormat.CSV);
	}

	/**
	 * @return the settings read from {@value #DEFAULT_RESOURCE}
	 */
	public static ExportSettings fromClasspath() {
		return fromClasspath(DEFAULT_RESOURCE);
	}

	/**
	 * Reads settings from a classpath properties resource. A missing resource, an unreadable one or an
	 * invalid key falls back to {@link #defaults()} for the keys concerned.
	 *
	 * @param resource the classpath resource name
	 * @return the settings
	 */
	public static ExportSettings fromClasspath(String resource) {
		Properties props = new Properties();
		try (InputStream in = ExportSettings.class.getClassLoader().getResourceAsStream(resource)) {
			if (in != null) {
				props.load(in);
				log.info("Export settings loaded from classpath {}", resource);
			} else {
				log.debug("No {} on classpath, using defaults", resource);
			}
		} catch (IOException e) {
			log.warn("Cannot read export settings {}: {}", resource, e.getMessage());
		}
		return fromProperties(props);
	}

	/**
	 * @param props the properties to read
	 * @return the settings
	 */
	public static ExportSettings fromProperties(Properties props) {
		ExportFormat format = ExportFormat.CSV;
		String rawFormat = props.getProperty("export.format");
		if (StringUtils.isNotBlank(rawFormat)) {
			ExportFormat parsed = EnumUtils.getEnumIgnoreCase(ExportFormat.class, rawFormat.trim());
			if (parsed == null) {
				log.warn("Unknown export.format={}, using {}", rawFormat, format);
			} else {
				format = parsed;
			}
		}

		char delimiter = DEFAULT_DELIMITER;
		String rawDelimiter = props.getProperty("export.delimiter");
		if (rawDelimiter != null) {
			if (rawDelimiter.length() == 1) {
				delimiter = rawDelimiter.charAt(0);
			} else {
				log.warn("export.delimiter must be a single character, got '{}', using '{}'", rawDelimiter, delimiter);
			}
		}

		String filename = StringUtils.defaultIfBlank(props.getProperty("export.filename"), DEFAULT_FILENAME);
		String contentType = StringUtils.defaultIfBlank(props.getProperty("export.contentType"), format.getContentType());
		return new ExportSettings(filename, contentType, delimiter, format);
	}

	public String getFilename() {
		return filename;
	}

	public String getContentType() {
		return contentType;
	}

	public char getDelimiter() {
		return delimiter;
	}

	public ExportFormat getFormat() {
		return format;
	}

	/**
	 * @return the filename hint with the extension of the format
	 */
	public String getFullFilename() {
		return filename + "." + format.getExtension();
	}

	public ExportSettings withFilename(String filename) {
		return new ExportSettings(filename, contentType, delimiter, format);
	}

	public ExportSettings withContentType(String contentType) {
		return new ExportSettings(filename, contentType, delimiter, format);
	}

	public ExportSettings withDelimiter(char delimiter) {
		return new ExportSettings(filename, contentType, delimiter, format);
	}

	/**
	 * Switches the format. The content type follows the new format.
	 *
	 * @param format the output format
	 * @return the modified copy
	 */
	public ExportSettings withFormat(ExportFormat format) {
		return new ExportSettings(filename, format.getContentType(), delimiter, format);
	}

	@Override
	public String toString() {
		return "ExportSettings[filename=" + filename + ", contentType=" + contentType
				+ ", delimiter=" + delimiter + ", format=" + format + "]";
	}
}
