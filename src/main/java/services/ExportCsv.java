package services;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;

import classes.ExportSettings;
import interfaces.ExportBaseInterface;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.io.output.ByteArrayOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class ExportCsv {

	private static final Logger log = LoggerFactory.getLogger(ExportCsv.class);

	public static final char QUOTE = '"';

	/**
	 * Buffered delivery: materializes the export, then writes it in one go.
	 *
	 * @param export   the export to serialize
	 * @param settings the delivery settings (delimiter)
	 * @return the CSV bytes, UTF-8 encoded
	 */
	public static byte[] generateCsv(ExportBaseInterface export, ExportSettings settings) {
		List<List<String>> rows = export.toList();
		ByteArrayOutputStream baos = new ByteArrayOutputStream();
		BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(baos, StandardCharsets.UTF_8));

		try (CSVPrinter csvPrinter = new CSVPrinter(writer, format(settings))) {
			csvPrinter.printRecords(rows);
			csvPrinter.flush();
		} catch (IOException e) {
			throw new RuntimeException("Error in CSV creation", e);
		}
		log.debug("CSV {} generated: {} rows", settings.getFullFilename(), rows.size());
		return baos.toByteArray();
	}

	/**
	 * Streamed delivery: pulls the rows one at a time and flushes each of them to {@code out}.
	 * The stream is flushed but not closed.
	 *
	 * @param export   the export to serialize
	 * @param out      the destination
	 * @param settings the delivery settings (delimiter)
	 * @return the number of rows written
	 */
	public static int writeCsv(ExportBaseInterface export, OutputStream out, ExportSettings settings) {
		Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
		int written = 0;
		try {
			CSVPrinter csvPrinter = new CSVPrinter(writer, format(settings));
			Iterator<List<String>> rows = export.rows();
			while (rows.hasNext()) {
				csvPrinter.printRecord(rows.next());
				csvPrinter.flush();
				written++;
			}
		} catch (IOException e) {
			throw new RuntimeException("Error in CSV creation", e);
		}
		log.debug("CSV {} streamed: {} rows", settings.getFullFilename(), written);
		return written;
	}

	/**
	 * @param settings the delivery settings
	 * @return the default CSV format with the configured delimiter
	 */
	static CSVFormat format(ExportSettings settings) {
		return CSVFormat.DEFAULT.builder()
								.setDelimiter(settings.getDelimiter())
								.setQuote(QUOTE)
								.build();
	}
}
