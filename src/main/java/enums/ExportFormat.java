package enums;

/**
 * Output formats a rendered export can be delivered in.
 */
public enum ExportFormat {

	CSV("text/csv", "csv"),
	XLSX("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", "xlsx");

	private final String contentType;
	private final String extension;

	ExportFormat(String contentType, String extension) {
		this.contentType = contentType;
		this.extension = extension;
	}

	/**
	 * @return the default content type label of the format
	 */
	public String getContentType() {
		return contentType;
	}

	/**
	 * @return the file extension, without the dot
	 */
	public String getExtension() {
		return extension;
	}
}
