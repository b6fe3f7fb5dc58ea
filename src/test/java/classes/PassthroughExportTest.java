package classes;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PassthroughExportTest {

	@Test
	void reproducesTableVerbatim() {
		List<List<String>> table = List.of(
				List.of("a", "b", "c"),
				List.of("1", "2", "3"),
				List.of("2", "3", "4"));

		assertEquals(table, new PassthroughExport(table).toList());
	}

	@Test
	void keepsEmptyAndShortRows() {
		List<List<String>> table = List.of(
				List.of("a", "b", "c"),
				List.of(),
				List.of("d", "e", "f"),
				List.of("g"));

		PassthroughExport export = new PassthroughExport(table);

		assertEquals(table, export.toList());
		assertEquals(List.of("a", "b", "c"), export.getHeaderLabels());
	}

	@Test
	void emptyTableYieldsNoRows() {
		PassthroughExport export = new PassthroughExport(List.of());

		assertFalse(export.rows().hasNext());
		assertTrue(export.getHeaderLabels().isEmpty());
	}

	@Test
	void laterChangesToInputAreNotSeen() {
		List<String> header = new ArrayList<>(List.of("a"));
		List<List<String>> table = new ArrayList<>();
		table.add(header);
		PassthroughExport export = new PassthroughExport(table);

		header.add("b");
		table.add(List.of("x"));

		assertEquals(List.of(List.of("a")), export.toList());
	}
}
