package services;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Iterator;
import java.util.List;

import classes.ExportSettings;
import interfaces.ExportBaseInterface;
import org.apache.commons.io.output.ByteArrayOutputStream;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.streaming.SXSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class ExportExcel {

	private static final Logger log = LoggerFactory.getLogger(ExportExcel.class);

	/**
	 * Number of rows SXSSF keeps in memory before flushing them to its temporary file.
	 */
	public static final int ROW_ACCESS_WINDOW = 100;

	/**
	 * Generates a workbook holding the export in a single sheet and returns its bytes.
	 *
	 * @param export   the export to write
	 * @param settings the delivery settings, the filename hint names the sheet
	 * @return the XLSX bytes
	 * @throws RuntimeException if the workbook cannot be written
	 */
	public static byte[] generateXlsx(ExportBaseInterface export, ExportSettings settings) {
		ByteArrayOutputStream baos = new ByteArrayOutputStream();
		writeXlsx(export, baos, settings);
		return baos.toByteArray();
	}

	/**
	 * Writes the export to {@code out} as a workbook with one sheet.
	 * <p>
	 * Each export row becomes a sheet row of string cells; an empty export row becomes an empty sheet row.
	 * The first row is written in bold. Rows are pulled lazily from the export and SXSSF keeps only
	 * {@value #ROW_ACCESS_WINDOW} of them in memory. The stream is not closed.
	 * </p>
	 *
	 * @param export   the export to write
	 * @param out      the destination
	 * @param settings the delivery settings, the filename hint names the sheet
	 * @return the number of rows written
	 * @throws RuntimeException if the workbook cannot be written
	 */
	public static int writeXlsx(ExportBaseInterface export, OutputStream out, ExportSettings settings) {
		SXSSFWorkbook workbook = new SXSSFWorkbook(ROW_ACCESS_WINDOW);
		int written = 0;
		try {
			Sheet sheet = workbook.createSheet(WorkbookUtil.createSafeSheetName(settings.getFilename()));
			CellStyle headerStyle = createHeaderStyle(workbook);

			Iterator<List<String>> rows = export.rows();
			while (rows.hasNext()) {
				List<String> values = rows.next();
				Row row = sheet.createRow(written);
				for (int i = 0; i < values.size(); i++) {
					Cell cell = row.createCell(i);
					cell.setCellValue(values.get(i));
					if (written == 0) {
						cell.setCellStyle(headerStyle);
					}
				}
				written++;
			}
			workbook.write(out);
		} catch (IOException e) {
			throw new RuntimeException("Error in XLSX creation", e);
		} finally {
			workbook.dispose();
			closeQuietly(workbook);
		}
		log.debug("XLSX {} written: {} rows", settings.getFullFilename(), written);
		return written;
	}

	/**
	 * @param workbook the workbook the style belongs to
	 * @return a bold text style for the header row
	 */
	private static CellStyle createHeaderStyle(Workbook workbook) {
		Font font = workbook.createFont();
		font.setBold(true);
		CellStyle style = workbook.createCellStyle();
		style.setFont(font);
		return style;
	}

	private static void closeQuietly(Workbook workbook) {
		try {
			workbook.close();
		} catch (IOException e) {
			log.warn("Cannot close workbook: {}", e.getMessage());
		}
	}
}
