package io.evitadb.lokit.document;

import io.evitadb.lokit.model.TranslatableUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PropertiesDocument should act as a translation document for properties files")
public class PropertiesDocumentTest {

	private static final String SOURCE = """
		# Application messages
		app.title=My Application

		! legacy section
		button.save = Save
		button.cancel: Cancel
		empty.value=
		""";

	@TempDir
	Path tempDir;

	@Test
	@DisplayName("keeps comments, blank lines and order when marshalling")
	void shouldRoundTripStructure() {
		final PropertiesDocument document = PropertiesDocument.parse(SOURCE);

		assertEquals(List.of("app.title", "button.save", "button.cancel", "empty.value"), document.keys());
		assertEquals("""
			# Application messages
			app.title=My Application

			! legacy section
			button.save=Save
			button.cancel=Cancel
			empty.value=
			""", document.marshal());
	}

	@Test
	@DisplayName("mirrors the source with empty values and source texts as units")
	void shouldMirrorSource() {
		final PropertiesDocument target = PropertiesDocument.mirror(PropertiesDocument.parse(SOURCE));

		final List<TranslatableUnit> units = target.unitsNeedingTranslation(false, false);

		assertEquals(List.of("app.title", "button.save", "button.cancel"), units.stream().map(TranslatableUnit::id).toList());
		assertEquals("Save", units.get(1).source());
		assertEquals(new DocumentStats(4, 0, 0), target.stats());
	}

	@Test
	@DisplayName("skips translated entries unless retranslating")
	void shouldSkipTranslatedEntries() {
		final PropertiesDocument target = PropertiesDocument.mirror(PropertiesDocument.parse(SOURCE));
		target.set("app.title", "Meine Anwendung");

		assertEquals(2, target.unitsNeedingTranslation(false, false).size());
		assertEquals(3, target.unitsNeedingTranslation(true, false).size());
		assertEquals("Meine Anwendung", target.get("app.title"));
		assertNull(target.get("missing"));
	}

	@Test
	@DisplayName("stores only the first plural form")
	void shouldStoreFormZeroOnly() {
		final PropertiesDocument target = PropertiesDocument.mirror(PropertiesDocument.parse(SOURCE));
		target.setForm("button.save", 0, "Speichern");
		target.setForm("button.save", 1, "ignored");

		assertEquals("Speichern", target.get("button.save"));
	}

	@Test
	@DisplayName("syncs an existing translation with the source structure")
	void shouldSyncWithSource() {
		final PropertiesDocument existing = PropertiesDocument.parse("""
			button.save=Speichern
			obsolete.key=Alt
			""");

		existing.syncWith(PropertiesDocument.parse(SOURCE));

		assertEquals(List.of("app.title", "button.save", "button.cancel", "empty.value"), existing.keys());
		assertEquals("Speichern", existing.get("button.save"));
		assertEquals(List.of("app.title", "button.cancel"),
			existing.unitsNeedingTranslation(false, false).stream().map(TranslatableUnit::id).toList());
	}

	@Test
	@DisplayName("keeps the first position and the last value of duplicate keys")
	void shouldMergeDuplicates() {
		final PropertiesDocument document = PropertiesDocument.parse("a=1\nb=2\na=3\n");

		assertEquals(Map.of("a", "3", "b", "2"), document.values());
		assertEquals(List.of("a", "b"), document.keys());
	}

	@Test
	@DisplayName("escapes line breaks in translated values so the file stays parseable")
	void shouldEscapeLineBreaksInValues() {
		final PropertiesDocument target = PropertiesDocument.mirror(
			PropertiesDocument.parse("greeting=Hello\\nWorld\nfarewell=Bye\n")
		);
		target.set("greeting", "Hallo\nWelt\r\tEnde");
		target.set("farewell", " Tschüss");

		final PropertiesDocument reread = PropertiesDocument.parse(target.marshal());

		assertEquals(List.of("greeting", "farewell"), reread.keys());
		assertEquals("Hallo\\nWelt\\r\\tEnde", reread.get("greeting"));
		assertEquals("\\ Tschüss", reread.get("farewell"));
		assertEquals(target.marshal(), reread.marshal(), "escaped values are written back unchanged");
	}

	@Test
	@DisplayName("persists into missing directories")
	void shouldPersistIntoMissingDirectories() throws Exception {
		final PropertiesDocument target = PropertiesDocument.mirror(PropertiesDocument.parse(SOURCE));
		target.set("button.cancel", "Zrušit");
		final Path file = tempDir.resolve("i18n/cs/messages_cs.properties");

		target.persist(file);

		final String written = Files.readString(file, StandardCharsets.UTF_8);
		assertTrue(written.contains("button.cancel=Zrušit\n"));
		assertTrue(written.startsWith("# Application messages\n"));
		assertEquals(target.marshal(), PropertiesDocument.read(file).marshal());
	}
}
