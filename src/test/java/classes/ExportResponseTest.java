package classes;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import enums.ExportFormat;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExportResponseTest {

	@Test
	void bufferedCsvResponse() {
		ComplexExport<DummyData> export = DummyData.exportBuilder().build();

		ExportResponse response = ExportResponse.buffered(export, ExportSettings.defaults().withFilename("hello"));

		assertFalse(response.isStreaming());
		assertEquals("text/csv", response.getContentType());
		assertEquals("attachment; filename=\"hello.csv\"", response.getContentDisposition());
		String expected = export.toList().stream()
				.map(row -> String.join(",", row))
				.collect(Collectors.joining("\r\n")) + "\r\n";
		assertEquals(expected, new String(response.getBody(), StandardCharsets.UTF_8));
	}

	@Test
	void streamingResponseWritesSameBytes() throws IOException {
		ReportExport report = new ReportExport(DummyData.exportBuilder().build(),
				new PassthroughExport(List.of(List.of("x", "y"), List.of("1", "2"))));
		ExportSettings settings = ExportSettings.defaults();

		ExportResponse streaming = ExportResponse.streaming(report, settings);
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		streaming.writeTo(out);

		assertTrue(streaming.isStreaming());
		assertThrows(IllegalStateException.class, streaming::getBody);
		assertArrayEquals(ExportResponse.buffered(report, settings).getBody(), out.toByteArray());
	}

	@Test
	void xlsxResponseUsesWorkbookContentType() throws IOException {
		ExportSettings settings = ExportSettings.defaults().withFormat(ExportFormat.XLSX).withFilename("book");

		ExportResponse response = ExportResponse.streaming(DummyData.exportBuilder().build(), settings);
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		response.writeTo(out);

		assertEquals(ExportFormat.XLSX.getContentType(), response.getContentType());
		assertEquals("attachment; filename=\"book.xlsx\"", response.getContentDisposition());
		assertTrue(out.size() > 0);
	}
}
