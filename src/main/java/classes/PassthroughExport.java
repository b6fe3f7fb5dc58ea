package classes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import interfaces.ExportBaseInterface;

/**
 * Re-emits an already tabular input as is.
 * <p>
 * The first inner list is taken as the header labels and the others as data rows. Nothing is extracted,
 * reordered or converted, and rows of any width, the empty row included, are kept verbatim.
 * </p>
 */
public class PassthroughExport implements ExportBaseInterface {

	private final List<List<String>> dati;

	/**
	 * @param dati the table, header labels first
	 */
	public PassthroughExport(List<? extends List<String>> dati) {
		List<List<String>> copy = new ArrayList<>();
		for (List<String> row : Objects.requireNonNull(dati, "dati")) {
			copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
		}
		this.dati = Collections.unmodifiableList(copy);
	}

	/**
	 * @return the header labels, or an empty list when the table is empty
	 */
	public List<String> getHeaderLabels() {
		return dati.isEmpty() ? Collections.emptyList() : dati.get(0);
	}

	@Override
	public Iterator<List<String>> rows() {
		return dati.iterator();
	}
}
