package io.evitadb.lokit;

import io.evitadb.lokit.document.DocumentStats;
import io.evitadb.lokit.document.TranslationDocument;
import io.evitadb.lokit.llm.LanguageNames;
import io.evitadb.lokit.llm.exception.ProviderException;
import io.evitadb.lokit.model.CancellationToken;
import io.evitadb.lokit.model.Chunk;
import io.evitadb.lokit.model.ChunkSplitter;
import io.evitadb.lokit.model.LanguageTask;
import io.evitadb.lokit.model.PluralTranslation;
import io.evitadb.lokit.model.RunOptions;
import io.evitadb.lokit.model.TranslatableUnit;
import io.evitadb.lokit.model.TranslationSummary;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Runs the chunks of all languages of a run, either language after language or all at once
 * bounded by a concurrency limit. A failing chunk marks its language as failed; the other languages
 * keep going. Every document that received work is persisted exactly once at the end of its work.
 */
public final class TaskScheduler {

	private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;
	private static final long PERMIT_POLL_MILLIS = 100;

	private final ChunkTranslator translator;
	private final RunOptions options;
	private final CancellationToken token;
	private final Function<LanguageTask, String> systemPrompts;
	private final Function<LanguageTask, Integer> pluralCounts;

	/**
	 * @param translator    translator issuing one call per chunk
	 * @param options       run settings and callbacks
	 * @param token         cancellation token of the run
	 * @param systemPrompts resolves the system prompt of a language
	 * @param pluralCounts  resolves the plural form count of a language
	 */
	public TaskScheduler(
		@Nonnull ChunkTranslator translator,
		@Nonnull RunOptions options,
		@Nonnull CancellationToken token,
		@Nonnull Function<LanguageTask, String> systemPrompts,
		@Nonnull Function<LanguageTask, Integer> pluralCounts
	) {
		this.translator = Objects.requireNonNull(translator, "translator must not be null");
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.token = Objects.requireNonNull(token, "token must not be null");
		this.systemPrompts = Objects.requireNonNull(systemPrompts, "systemPrompts must not be null");
		this.pluralCounts = Objects.requireNonNull(pluralCounts, "pluralCounts must not be null");
	}

	/**
	 * Runs all tasks in the configured concurrency mode.
	 *
	 * @param tasks languages to translate, in order
	 * @return summary of the run, failed languages listed in task order
	 */
	@Nonnull
	public TranslationSummary run(@Nonnull List<LanguageTask> tasks) {
		Objects.requireNonNull(tasks, "tasks must not be null");
		if (tasks.isEmpty()) {
			return TranslationSummary.empty();
		}
		return switch (this.options.getMode()) {
			case SEQUENTIAL -> runSequential(tasks);
			case FULL_PARALLEL -> runParallel(tasks);
		};
	}

	@Nonnull
	private TranslationSummary runSequential(@Nonnull List<LanguageTask> tasks) {
		final ChunkSplitter splitter = new ChunkSplitter(this.options.getChunkSize());
		TranslationSummary summary = TranslationSummary.empty();

		for (final LanguageTask task : tasks) {
			if (this.token.isCancelled()) {
				return summary.withCancelled();
			}

			final PreparedLanguage prepared = prepare(task, splitter);
			if (prepared.chunks().isEmpty()) {
				this.options.log("[" + task.language() + "] Nothing to translate");
				continue;
			}
			this.options.log(
				"Translating " + task.language() + " (" + prepared.languageName() + "): " + prepared.total() + " entries..."
			);

			int done = 0;
			try {
				for (final Chunk chunk : prepared.chunks()) {
					if (chunk.index() > 0) {
						this.token.sleep(this.options.getRequestDelay());
					}
					this.token.throwIfCancelled();
					this.options.verbose("[" + task.language() + "] " + chunk);

					final List<PluralTranslation> results =
						this.translator.translate(chunk, prepared.systemPrompt(), prepared.nplurals());
					final int applied = ChunkTranslator.apply(
						chunk, results, task.document(), this.options.isIncludeFuzzy()
					);
					summary = summary.withChunk(applied);
					done += chunk.size();
					this.options.progress(task.language(), done, prepared.total());
				}
			} catch (CancellationException e) {
				persist(task.document(), task.outputPath());
				return summary.withCancelled();
			} catch (ProviderException e) {
				this.options.error("Error translating " + task.language() + ": " + e.getMessage());
				summary = summary.withFailedLanguage(task.language());
			}

			if (!persist(task.document(), task.outputPath())) {
				summary = summary.withFailedLanguage(task.language());
			}
		}
		return summary;
	}

	@Nonnull
	private TranslationSummary runParallel(@Nonnull List<LanguageTask> tasks) {
		final ChunkSplitter splitter = new ChunkSplitter(this.options.getChunkSize());

		final List<WorkItem> items = new ArrayList<>();
		final Map<Path, Object> locks = new ConcurrentHashMap<>();
		for (final LanguageTask task : tasks) {
			final PreparedLanguage prepared = prepare(task, splitter);
			if (prepared.chunks().isEmpty()) {
				this.options.log("[" + task.language() + "] Nothing to translate");
				continue;
			}
			locks.computeIfAbsent(lockKey(task.outputPath()), path -> new Object());
			for (final Chunk chunk : prepared.chunks()) {
				items.add(new WorkItem(prepared, chunk));
			}
		}
		if (items.isEmpty()) {
			return TranslationSummary.empty();
		}

		this.options.log(
			"Translating " + items.size() + " chunks across " + tasks.size() + " language(s) (max " +
				this.options.getMaxConcurrent() + " concurrent)"
		);

		final AtomicReference<TranslationSummary> summary = new AtomicReference<>(TranslationSummary.empty());
		final Semaphore permits = new Semaphore(this.options.getMaxConcurrent());
		// written by the launching thread only
		final Set<LanguageTask> launched = Collections.newSetFromMap(new IdentityHashMap<>());
		final List<CompletableFuture<Void>> futures = new ArrayList<>(items.size());
		final ExecutorService executor = Executors.newFixedThreadPool(
			Math.min(this.options.getMaxConcurrent(), items.size())
		);

		boolean cancelled = false;
		try {
			for (int i = 0; i < items.size(); i++) {
				final WorkItem item = items.get(i);
				try {
					if (i > 0) {
						this.token.sleep(this.options.getRequestDelay());
					}
					acquire(permits);
				} catch (CancellationException e) {
					cancelled = true;
					break;
				}

				launched.add(item.language().task());
				futures.add(CompletableFuture.runAsync(() -> {
					try {
						runItem(item, locks, summary);
					} finally {
						permits.release();
					}
				}, executor));
			}

			try {
				CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
			} catch (CompletionException e) {
				this.options.error("Error waiting for translations to complete: " + e.getMessage());
			}
		} finally {
			shutdown(executor);
		}

		TranslationSummary result = summary.get();
		if (cancelled || this.token.isCancelled()) {
			result = result.withCancelled();
		}

		final Set<Path> persisted = new LinkedHashSet<>();
		for (final LanguageTask task : tasks) {
			if (launched.contains(task) && persisted.add(lockKey(task.outputPath()))
				&& !persist(task.document(), task.outputPath())) {
				result = result.withFailedLanguage(task.language());
			}
		}

		return inTaskOrder(result, tasks);
	}

	private void runItem(
		@Nonnull WorkItem item,
		@Nonnull Map<Path, Object> locks,
		@Nonnull AtomicReference<TranslationSummary> summary
	) {
		final PreparedLanguage prepared = item.language();
		final LanguageTask task = prepared.task();
		final Chunk chunk = item.chunk();
		try {
			this.options.verbose("[" + task.language() + "] " + chunk);
			final List<PluralTranslation> results =
				this.translator.translate(chunk, prepared.systemPrompt(), prepared.nplurals());

			final int applied;
			synchronized (locks.get(lockKey(task.outputPath()))) {
				applied = ChunkTranslator.apply(chunk, results, task.document(), this.options.isIncludeFuzzy());
			}
			summary.updateAndGet(current -> current.withChunk(applied));

			final int done = prepared.done().addAndGet(chunk.size());
			this.options.progress(task.language(), done, prepared.total());
		} catch (CancellationException e) {
			summary.updateAndGet(TranslationSummary::withCancelled);
		} catch (ProviderException e) {
			this.options.error(
				"Error translating " + task.language() + " (chunk " + (chunk.index() + 1) + "/" + chunk.count() + "): " +
					e.getMessage()
			);
			summary.updateAndGet(current -> current.withFailedLanguage(task.language()));
		}
	}

	/**
	 * Waits for a permit, giving up as soon as the run is cancelled.
	 */
	private void acquire(@Nonnull Semaphore permits) {
		try {
			while (!permits.tryAcquire(PERMIT_POLL_MILLIS, TimeUnit.MILLISECONDS)) {
				this.token.throwIfCancelled();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			final CancellationException cancellation = new CancellationException("Interrupted while waiting for a worker");
			cancellation.initCause(e);
			throw cancellation;
		}
		if (this.token.isCancelled()) {
			permits.release();
			this.token.throwIfCancelled();
		}
	}

	@Nonnull
	private PreparedLanguage prepare(@Nonnull LanguageTask task, @Nonnull ChunkSplitter splitter) {
		final TranslationDocument document = task.document();
		final List<TranslatableUnit> units = document.unitsNeedingTranslation(
			this.options.isRetranslateExisting(), this.options.isIncludeFuzzy()
		);
		final List<Chunk> chunks = splitter.split(task.language(), units);
		return new PreparedLanguage(
			task,
			chunks,
			units.size(),
			chunks.isEmpty() ? "" : this.systemPrompts.apply(task),
			chunks.isEmpty() ? 0 : this.pluralCounts.apply(task),
			new AtomicInteger()
		);
	}

	/**
	 * Persists the document and reports the outcome.
	 *
	 * @return false when the document could not be written
	 */
	private boolean persist(@Nonnull TranslationDocument document, @Nonnull Path path) {
		try {
			document.persist(path);
		} catch (IOException e) {
			this.options.error("Failed to save " + path + ": " + e.getMessage());
			return false;
		}
		final DocumentStats stats = document.stats();
		this.options.log("Saved " + path + " (" + stats.translated() + "/" + stats.total() + " translated)");
		return true;
	}

	@Nonnull
	private static TranslationSummary inTaskOrder(@Nonnull TranslationSummary summary, @Nonnull List<LanguageTask> tasks) {
		if (summary.failedLanguages().size() < 2) {
			return summary;
		}
		final Set<String> ordered = new LinkedHashSet<>();
		for (final LanguageTask task : tasks) {
			if (summary.failedLanguages().contains(task.language())) {
				ordered.add(task.language());
			}
		}
		return new TranslationSummary(
			summary.translatedUnits(), summary.calls(), new ArrayList<>(ordered), summary.cancelled()
		);
	}

	@Nonnull
	private static Path lockKey(@Nonnull Path path) {
		return path.toAbsolutePath().normalize();
	}

	private void shutdown(@Nonnull ExecutorService executor) {
		executor.shutdown();
		try {
			if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
				this.options.error("Workers did not terminate in time, forcing shutdown");
				executor.shutdownNow();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			executor.shutdownNow();
		}
	}

	/**
	 * Per-language state of a run.
	 *
	 * @param task         language task
	 * @param chunks       chunks of the units needing translation
	 * @param total        number of units needing translation
	 * @param systemPrompt resolved system prompt, empty when there is nothing to translate
	 * @param nplurals     plural form count of the language
	 * @param done         units finished so far, shared by the language's workers
	 */
	private record PreparedLanguage(
		@Nonnull LanguageTask task,
		@Nonnull List<Chunk> chunks,
		int total,
		@Nonnull String systemPrompt,
		int nplurals,
		@Nonnull AtomicInteger done
	) {

		@Nonnull
		String languageName() {
			return this.task.displayName() == null ? LanguageNames.nativeName(this.task.language()) : this.task.displayName();
		}
	}

	private record WorkItem(@Nonnull PreparedLanguage language, @Nonnull Chunk chunk) {
	}
}
