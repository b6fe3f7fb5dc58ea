package classes;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

import enums.ExportFormat;
import interfaces.ExportBaseInterface;
import services.ExportCsv;
import services.ExportExcel;

/**
 * A downloadable rendering of an export, independent of the transport that sends it.
 * <p>
 * A buffered response renders the whole body when it is created; a streaming response renders
 * nothing until {@link #writeTo(OutputStream)} pulls the rows one at a time.
 * </p>
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * ExportResponse response = ExportResponse.streaming(report, settings.withFilename("orders"));
 * servletResponse.setContentType(response.getContentType());
 * servletResponse.setHeader("Content-Disposition", response.getContentDisposition());
 * response.writeTo(servletResponse.getOutputStream());
 * }</pre>
 */
public final class ExportResponse {

	private final ExportSettings settings;
	private final ExportBaseInterface export;
	private final byte[] body;

	private ExportResponse(ExportSettings settings, ExportBaseInterface export, byte[] body) {
		this.settings = settings;
		this.export = export;
		this.body = body;
	}

	/**
	 * Renders the export now.
	 *
	 * @param export   the export to render
	 * @param settings the delivery settings
	 * @return a response holding the rendered body
	 */
	public static ExportResponse buffered(ExportBaseInterface export, ExportSettings settings) {
		Objects.requireNonNull(export, "export");
		Objects.requireNonNull(settings, "settings");
		byte[] body = settings.getFormat() == ExportFormat.XLSX
				? ExportExcel.generateXlsx(export, settings)
				: ExportCsv.generateCsv(export, settings);
		return new ExportResponse(settings, null, body);
	}

	/**
	 * Defers rendering to {@link #writeTo(OutputStream)}.
	 *
	 * @param export   the export to render
	 * @param settings the delivery settings
	 * @return a response rendering the export on demand
	 */
	public static ExportResponse streaming(ExportBaseInterface export, ExportSettings settings) {
		return new ExportResponse(Objects.requireNonNull(settings, "settings"), Objects.requireNonNull(export, "export"), null);
	}

	public String getContentType() {
		return settings.getContentType();
	}

	/**
	 * @return the attachment disposition, e.g. {@code attachment; filename="export.csv"}
	 */
	public String getContentDisposition() {
		return "attachment; filename=\"" + settings.getFullFilename() + "\"";
	}

	public boolean isStreaming() {
		return body == null;
	}

	/**
	 * @return the rendered body
	 * @throws IllegalStateException on a streaming response
	 */
	public byte[] getBody() {
		if (isStreaming()) {
			throw new IllegalStateException("Streaming response has no buffered body");
		}
		return body.clone();
	}

	/**
	 * Writes the body to {@code out}. A streaming response starts a new production of the export on each call.
	 *
	 * @param out the destination, flushed but not closed
	 * @throws IOException if {@code out} fails
	 */
	public void writeTo(OutputStream out) throws IOException {
		if (!isStreaming()) {
			out.write(body);
		} else if (settings.getFormat() == ExportFormat.XLSX) {
			ExportExcel.writeXlsx(export, out, settings);
		} else {
			ExportCsv.writeCsv(export, out, settings);
		}
		out.flush();
	}
}
