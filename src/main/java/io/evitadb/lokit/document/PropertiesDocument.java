package io.evitadb.lokit.document;

import io.evitadb.lokit.model.TranslatableUnit;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Java {@code .properties} file as a translation document. Each language lives in its own file;
 * the target file mirrors the source file line by line with translated values.
 *
 * Comments ({@code #} or {@code !}) and blank lines are kept verbatim. Entries are split on the
 * first {@code =} or {@code :} with surrounding whitespace removed. An entry with an empty value
 * counts as untranslated. Backslash line continuations and unicode escapes are not interpreted,
 * values are written back exactly as they were read. Line breaks, tabs and a leading space in
 * translated values are escaped on write.
 */
public final class PropertiesDocument implements TranslationDocument {

	private final List<Line> lines;
	private final Map<String, Integer> index;
	/**
	 * Source-language values by key, null when the document is not bound to a source file.
	 */
	@Nullable private Map<String, String> sourceValues;

	private PropertiesDocument(@Nonnull List<Line> lines, @Nullable Map<String, String> sourceValues) {
		this.lines = lines;
		this.index = new HashMap<>();
		for (int i = 0; i < lines.size(); i++) {
			final Line line = lines.get(i);
			if (line.kind() == LineKind.ENTRY) {
				this.index.put(line.key(), i);
			}
		}
		this.sourceValues = sourceValues;
	}

	/**
	 * Parses properties content.
	 *
	 * @param content file content, {@code \r\n} line endings are normalized
	 * @return parsed document not bound to any source
	 */
	@Nonnull
	public static PropertiesDocument parse(@Nonnull String content) {
		Objects.requireNonNull(content, "content must not be null");

		final String text = content.replace("\r\n", "\n");
		final List<String> rawLines = new ArrayList<>(List.of(text.split("\n", -1)));
		if (!rawLines.isEmpty() && rawLines.get(rawLines.size() - 1).isEmpty()) {
			rawLines.remove(rawLines.size() - 1);
		}

		final List<Line> lines = new ArrayList<>(rawLines.size());
		final Map<String, Integer> seen = new HashMap<>();
		for (final String raw : rawLines) {
			final String trimmed = raw.trim();
			if (trimmed.isEmpty()) {
				lines.add(Line.blank(raw));
			} else if (trimmed.startsWith("#") || trimmed.startsWith("!")) {
				lines.add(Line.comment(raw));
			} else {
				final Line entry = splitKeyValue(trimmed);
				if (entry.key().isEmpty()) {
					// malformed line, kept verbatim
					lines.add(Line.comment(raw));
				} else if (seen.containsKey(entry.key())) {
					// duplicate key keeps the first position with the last value
					final int position = seen.get(entry.key());
					lines.set(position, lines.get(position).withValue(entry.value()));
				} else {
					seen.put(entry.key(), lines.size());
					lines.add(entry);
				}
			}
		}
		return new PropertiesDocument(lines, null);
	}

	/**
	 * Reads and parses a properties file encoded in UTF-8.
	 *
	 * @param path file to read
	 * @return parsed document
	 * @throws IOException when the file cannot be read
	 */
	@Nonnull
	public static PropertiesDocument read(@Nonnull Path path) throws IOException {
		Objects.requireNonNull(path, "path must not be null");
		return parse(Files.readString(path, StandardCharsets.UTF_8));
	}

	/**
	 * Creates an empty translation of the source: same lines, same keys, all values cleared.
	 * The returned document takes its source texts from the given source.
	 *
	 * @param source source-language document
	 * @return new target document
	 */
	@Nonnull
	public static PropertiesDocument mirror(@Nonnull PropertiesDocument source) {
		Objects.requireNonNull(source, "source must not be null");

		final List<Line> lines = new ArrayList<>(source.lines.size());
		for (final Line line : source.lines) {
			lines.add(line.kind() == LineKind.ENTRY ? line.withValue("") : line);
		}
		return new PropertiesDocument(lines, source.values());
	}

	/**
	 * Rebuilds this document from the structure of the source. Existing translations are kept,
	 * keys new in the source are added untranslated and keys no longer in the source are removed.
	 *
	 * @param source source-language document
	 * @return this document, now bound to the source
	 */
	@Nonnull
	public PropertiesDocument syncWith(@Nonnull PropertiesDocument source) {
		final Map<String, String> existing = values();
		final PropertiesDocument rebuilt = mirror(source);
		for (final Map.Entry<String, Integer> entry : rebuilt.index.entrySet()) {
			final String translation = existing.get(entry.getKey());
			if (translation != null) {
				rebuilt.lines.set(entry.getValue(), rebuilt.lines.get(entry.getValue()).withValue(translation));
			}
		}
		this.lines.clear();
		this.lines.addAll(rebuilt.lines);
		this.index.clear();
		this.index.putAll(rebuilt.index);
		this.sourceValues = rebuilt.sourceValues;
		return this;
	}

	/**
	 * Returns all keys in document order.
	 *
	 * @return keys
	 */
	@Nonnull
	public List<String> keys() {
		final List<String> keys = new ArrayList<>(this.index.size());
		for (final Line line : this.lines) {
			if (line.kind() == LineKind.ENTRY) {
				keys.add(line.key());
			}
		}
		return keys;
	}

	/**
	 * Returns key to value map in document order.
	 *
	 * @return copy of all entries
	 */
	@Nonnull
	public Map<String, String> values() {
		final Map<String, String> values = new LinkedHashMap<>();
		for (final Line line : this.lines) {
			if (line.kind() == LineKind.ENTRY) {
				values.put(line.key(), line.value());
			}
		}
		return values;
	}

	@Nonnull
	@Override
	public List<TranslatableUnit> unitsNeedingTranslation(boolean retranslate, boolean includeFuzzy) {
		final List<TranslatableUnit> units = new ArrayList<>();
		for (final Line line : this.lines) {
			if (line.kind() != LineKind.ENTRY) {
				continue;
			}
			if (!retranslate && !line.value().isEmpty()) {
				continue;
			}
			final String source = sourceText(line);
			if (!source.isEmpty()) {
				units.add(new TranslatableUnit(line.key(), source, null, List.of(), false));
			}
		}
		return Collections.unmodifiableList(units);
	}

	@Nullable
	@Override
	public String get(@Nonnull String id) {
		final Integer position = this.index.get(id);
		return position == null ? null : this.lines.get(position).value();
	}

	@Override
	public void set(@Nonnull String id, @Nonnull String value) {
		Objects.requireNonNull(value, "value must not be null");
		final Integer position = this.index.get(id);
		if (position != null) {
			this.lines.set(position, this.lines.get(position).withValue(value));
		}
	}

	/**
	 * Properties have no plural forms, only form zero is stored.
	 */
	@Override
	public void setForm(@Nonnull String id, int formIndex, @Nonnull String value) {
		if (formIndex == 0) {
			set(id, value);
		}
	}

	@Override
	public void clearNeedsReview(@Nonnull String id) {
		// properties carry no review markers
	}

	@Nonnull
	@Override
	public DocumentStats stats() {
		int total = 0;
		int translated = 0;
		for (final Line line : this.lines) {
			if (line.kind() == LineKind.ENTRY) {
				total++;
				if (!line.value().isEmpty()) {
					translated++;
				}
			}
		}
		return new DocumentStats(total, translated, 0);
	}

	/**
	 * Serializes the document, one {@code key=value} per entry.
	 *
	 * @return file content
	 */
	@Nonnull
	public String marshal() {
		final StringBuilder sb = new StringBuilder();
		for (final Line line : this.lines) {
			switch (line.kind()) {
				case BLANK -> sb.append('\n');
				case COMMENT -> sb.append(line.raw()).append('\n');
				case ENTRY -> sb.append(line.key()).append('=').append(escapeValue(line.value())).append('\n');
			}
		}
		return sb.toString();
	}

	@Override
	public void persist(@Nonnull Path path) throws IOException {
		Objects.requireNonNull(path, "path must not be null");
		final Path parent = path.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.writeString(path, marshal(), StandardCharsets.UTF_8);
	}

	@Nonnull
	private String sourceText(@Nonnull Line line) {
		if (this.sourceValues == null) {
			return line.key();
		}
		final String source = this.sourceValues.get(line.key());
		return source == null ? "" : source;
	}

	/**
	 * Escapes line breaks, tabs and a leading space so that the value stays on its line. Existing
	 * escape sequences are written as they are.
	 */
	@Nonnull
	static String escapeValue(@Nonnull String value) {
		final StringBuilder sb = new StringBuilder(value.length());
		for (int i = 0; i < value.length(); i++) {
			final char ch = value.charAt(i);
			switch (ch) {
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				case ' ' -> sb.append(i == 0 ? "\\ " : " ");
				default -> sb.append(ch);
			}
		}
		return sb.toString();
	}

	@Nonnull
	private static Line splitKeyValue(@Nonnull String trimmed) {
		for (int i = 0; i < trimmed.length(); i++) {
			final char ch = trimmed.charAt(i);
			if (ch == '=' || ch == ':') {
				return Line.entry(trimmed.substring(0, i).trim(), trimmed.substring(i + 1).trim());
			}
		}
		return Line.entry(trimmed, "");
	}

	private enum LineKind {
		BLANK, COMMENT, ENTRY
	}

	/**
	 * One physical line of the file. {@code raw} is set for blank and comment lines,
	 * {@code key} and {@code value} for entries.
	 */
	private record Line(@Nonnull LineKind kind, @Nonnull String raw, @Nonnull String key, @Nonnull String value) {

		static Line blank(@Nonnull String raw) {
			return new Line(LineKind.BLANK, raw, "", "");
		}

		static Line comment(@Nonnull String raw) {
			return new Line(LineKind.COMMENT, raw, "", "");
		}

		static Line entry(@Nonnull String key, @Nonnull String value) {
			return new Line(LineKind.ENTRY, "", key, value);
		}

		Line withValue(@Nonnull String newValue) {
			return new Line(this.kind, this.raw, this.key, newValue);
		}
	}
}
