package io.evitadb.lokit;

import io.evitadb.lokit.document.TranslationDocument;
import io.evitadb.lokit.llm.PromptBuilder;
import io.evitadb.lokit.llm.ProviderRoute;
import io.evitadb.lokit.llm.RateLimitCoordinator;
import io.evitadb.lokit.llm.RequestExecutor;
import io.evitadb.lokit.llm.TranslationArrayParser;
import io.evitadb.lokit.model.CancellationToken;
import io.evitadb.lokit.model.Chunk;
import io.evitadb.lokit.model.PluralTranslation;
import io.evitadb.lokit.model.TranslatableUnit;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Translates one chunk with one outbound call and writes the results into a document.
 * Chunks containing plural units use the plural-aware prompt and response format.
 */
public final class ChunkTranslator {

	private final ProviderRoute route;
	private final RequestExecutor executor;
	private final RateLimitCoordinator rateLimit;
	private final int maxRetries;
	private final CancellationToken token;

	/**
	 * @param route      provider route of the run
	 * @param executor   executor issuing the calls
	 * @param rateLimit  pause shared by all workers of the run
	 * @param maxRetries retries per call after the first attempt
	 * @param token      cancellation token of the run
	 */
	public ChunkTranslator(
		@Nonnull ProviderRoute route,
		@Nonnull RequestExecutor executor,
		@Nonnull RateLimitCoordinator rateLimit,
		int maxRetries,
		@Nonnull CancellationToken token
	) {
		this.route = Objects.requireNonNull(route, "route must not be null");
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
		this.rateLimit = Objects.requireNonNull(rateLimit, "rateLimit must not be null");
		this.maxRetries = maxRetries;
		this.token = Objects.requireNonNull(token, "token must not be null");
	}

	/**
	 * Translates the chunk.
	 *
	 * @param chunk        chunk to translate
	 * @param systemPrompt resolved system prompt of the chunk's language
	 * @param nplurals     plural form count of the chunk's language
	 * @return results by position, possibly fewer than the chunk's units
	 * @throws io.evitadb.lokit.llm.exception.ProviderException when the call or decoding fails
	 */
	@Nonnull
	public List<PluralTranslation> translate(@Nonnull Chunk chunk, @Nonnull String systemPrompt, int nplurals) {
		Objects.requireNonNull(chunk, "chunk must not be null");
		Objects.requireNonNull(systemPrompt, "systemPrompt must not be null");

		if (chunk.hasPlurals()) {
			final String text = this.executor.execute(
				this.route, systemPrompt, PromptBuilder.pluralUserPrompt(chunk.units(), nplurals),
				this.rateLimit, this.maxRetries, this.token
			);
			return TranslationArrayParser.parsePlural(text, chunk.units(), nplurals);
		}

		final String text = this.executor.execute(
			this.route, systemPrompt, PromptBuilder.userPrompt(chunk.units()),
			this.rateLimit, this.maxRetries, this.token
		);
		final List<String> strings = TranslationArrayParser.parseStrings(text, chunk.size());
		final int count = Math.min(strings.size(), chunk.size());
		final List<PluralTranslation> results = new ArrayList<>(count);
		for (int i = 0; i < count; i++) {
			results.add(PluralTranslation.single(strings.get(i)));
		}
		return results;
	}

	/**
	 * Writes results into the document by position. Empty strings are never written; for plural
	 * results each non-empty form goes to its own slot and the remaining slots stay untouched.
	 * The needs-review marker is cleared only with {@code includeFuzzy} and a non-empty result.
	 * The caller must hold the document's lock.
	 *
	 * @param chunk        translated chunk
	 * @param results      results of {@link #translate}
	 * @param document     document receiving the results
	 * @param includeFuzzy whether the run translates units needing review
	 * @return number of units that received a non-empty result
	 */
	public static int apply(
		@Nonnull Chunk chunk,
		@Nonnull List<PluralTranslation> results,
		@Nonnull TranslationDocument document,
		boolean includeFuzzy
	) {
		int applied = 0;
		final int count = Math.min(results.size(), chunk.size());
		for (int i = 0; i < count; i++) {
			final TranslatableUnit unit = chunk.units().get(i);
			final PluralTranslation result = results.get(i);
			if (!result.hasContent()) {
				continue;
			}
			if (unit.isPlural() && result.isPlural()) {
				final List<String> forms = result.forms();
				for (int form = 0; form < forms.size(); form++) {
					if (!forms.get(form).isEmpty()) {
						document.setForm(unit.id(), form, forms.get(form));
					}
				}
			} else if (result.isPlural()) {
				document.set(unit.id(), firstNonEmpty(result.forms()));
			} else {
				document.set(unit.id(), result.singular());
			}
			if (includeFuzzy && unit.needsReview()) {
				document.clearNeedsReview(unit.id());
			}
			applied++;
		}
		return applied;
	}

	@Nonnull
	private static String firstNonEmpty(@Nonnull List<String> forms) {
		for (final String form : forms) {
			if (!form.isEmpty()) {
				return form;
			}
		}
		return "";
	}
}
