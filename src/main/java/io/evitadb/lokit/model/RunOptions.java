package io.evitadb.lokit.model;

import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Settings of one translation run. Instances are immutable and created by {@link #builder()}.
 */
public final class RunOptions {

	public static final int DEFAULT_MAX_CONCURRENT = 3;
	public static final int DEFAULT_MAX_RETRIES = 3;

	private final int chunkSize;
	private final ConcurrencyMode mode;
	private final int maxConcurrent;
	private final Duration requestDelay;
	@Nullable private final Duration timeout;
	private final int maxRetries;
	private final boolean retranslateExisting;
	private final boolean includeFuzzy;
	@Nullable private final String systemPrompt;
	@Nullable private final String promptType;
	private final boolean verbose;
	private final ProgressListener progressListener;
	private final Consumer<String> logListener;
	private final Consumer<String> errorListener;

	private RunOptions(@Nonnull Builder builder) {
		this.chunkSize = builder.chunkSize;
		this.mode = builder.mode;
		this.maxConcurrent = builder.maxConcurrent;
		this.requestDelay = builder.requestDelay;
		this.timeout = builder.timeout;
		this.maxRetries = builder.maxRetries;
		this.retranslateExisting = builder.retranslateExisting;
		this.includeFuzzy = builder.includeFuzzy;
		this.systemPrompt = builder.systemPrompt;
		this.promptType = builder.promptType;
		this.verbose = builder.verbose;
		this.progressListener = builder.progressListener;
		this.logListener = builder.logListener;
		this.errorListener = builder.errorListener;
	}

	@Nonnull
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Returns the number of units per chunk, zero or less for a single chunk per language.
	 */
	public int getChunkSize() {
		return this.chunkSize;
	}

	@Nonnull
	public ConcurrencyMode getMode() {
		return this.mode;
	}

	public int getMaxConcurrent() {
		return this.maxConcurrent;
	}

	/**
	 * Returns the delay between launching two chunks (between chunks in sequential mode).
	 */
	@Nonnull
	public Duration getRequestDelay() {
		return this.requestDelay;
	}

	/**
	 * Returns the per-call timeout, null to use the provider's timeout.
	 */
	@Nullable
	public Duration getTimeout() {
		return this.timeout;
	}

	public int getMaxRetries() {
		return this.maxRetries;
	}

	public boolean isRetranslateExisting() {
		return this.retranslateExisting;
	}

	public boolean isIncludeFuzzy() {
		return this.includeFuzzy;
	}

	/**
	 * Returns the custom system prompt template, null to use {@link #getPromptType()}.
	 */
	@Nullable
	public String getSystemPrompt() {
		return this.systemPrompt;
	}

	@Nullable
	public String getPromptType() {
		return this.promptType;
	}

	public boolean isVerbose() {
		return this.verbose;
	}

	@Nonnull
	public ProgressListener getProgressListener() {
		return this.progressListener;
	}

	public void progress(@Nonnull String language, int done, int total) {
		this.progressListener.onProgress(language, done, total);
	}

	public void log(@Nonnull String message) {
		this.logListener.accept(message);
	}

	public void error(@Nonnull String message) {
		this.errorListener.accept(message);
	}

	/**
	 * Reports the message through the log callback only in verbose mode.
	 *
	 * @param message diagnostic message
	 */
	public void verbose(@Nonnull String message) {
		if (this.verbose) {
			this.logListener.accept(message);
		}
	}

	@Override
	public String toString() {
		return "RunOptions[chunkSize=" + this.chunkSize + ", mode=" + this.mode.getId() +
			", maxConcurrent=" + this.maxConcurrent + ", requestDelay=" + this.requestDelay +
			", timeout=" + this.timeout + ", maxRetries=" + this.maxRetries +
			", retranslateExisting=" + this.retranslateExisting + ", includeFuzzy=" + this.includeFuzzy +
			", promptType=" + this.promptType + ", verbose=" + this.verbose + "]";
	}

	/**
	 * Builder of {@link RunOptions}. Callbacks default to no-ops.
	 */
	public static final class Builder {

		private int chunkSize;
		private ConcurrencyMode mode = ConcurrencyMode.SEQUENTIAL;
		private int maxConcurrent = DEFAULT_MAX_CONCURRENT;
		private Duration requestDelay = Duration.ZERO;
		@Nullable private Duration timeout;
		private int maxRetries = DEFAULT_MAX_RETRIES;
		private boolean retranslateExisting;
		private boolean includeFuzzy;
		@Nullable private String systemPrompt;
		@Nullable private String promptType;
		private boolean verbose;
		private ProgressListener progressListener = ProgressListener.NONE;
		private Consumer<String> logListener = message -> {
		};
		private Consumer<String> errorListener = message -> {
		};

		private Builder() {
		}

		@Nonnull
		public Builder chunkSize(int chunkSize) {
			this.chunkSize = chunkSize;
			return this;
		}

		@Nonnull
		public Builder mode(@Nonnull ConcurrencyMode mode) {
			this.mode = Objects.requireNonNull(mode, "mode must not be null");
			return this;
		}

		@Nonnull
		public Builder maxConcurrent(int maxConcurrent) {
			if (maxConcurrent < 1) {
				throw new IllegalArgumentException("maxConcurrent must be at least 1 but was " + maxConcurrent);
			}
			this.maxConcurrent = maxConcurrent;
			return this;
		}

		@Nonnull
		public Builder requestDelay(@Nonnull Duration requestDelay) {
			Objects.requireNonNull(requestDelay, "requestDelay must not be null");
			if (requestDelay.isNegative()) {
				throw new IllegalArgumentException("requestDelay must not be negative");
			}
			this.requestDelay = requestDelay;
			return this;
		}

		@Nonnull
		public Builder timeout(@Nullable Duration timeout) {
			if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
				throw new IllegalArgumentException("timeout must be positive");
			}
			this.timeout = timeout;
			return this;
		}

		@Nonnull
		public Builder maxRetries(int maxRetries) {
			if (maxRetries < 0) {
				throw new IllegalArgumentException("maxRetries must not be negative but was " + maxRetries);
			}
			this.maxRetries = maxRetries;
			return this;
		}

		@Nonnull
		public Builder retranslateExisting(boolean retranslateExisting) {
			this.retranslateExisting = retranslateExisting;
			return this;
		}

		@Nonnull
		public Builder includeFuzzy(boolean includeFuzzy) {
			this.includeFuzzy = includeFuzzy;
			return this;
		}

		@Nonnull
		public Builder systemPrompt(@Nullable String systemPrompt) {
			this.systemPrompt = systemPrompt;
			return this;
		}

		@Nonnull
		public Builder promptType(@Nullable String promptType) {
			this.promptType = promptType;
			return this;
		}

		@Nonnull
		public Builder verbose(boolean verbose) {
			this.verbose = verbose;
			return this;
		}

		@Nonnull
		public Builder onProgress(@Nonnull ProgressListener progressListener) {
			this.progressListener = Objects.requireNonNull(progressListener, "progressListener must not be null");
			return this;
		}

		@Nonnull
		public Builder onLog(@Nonnull Consumer<String> logListener) {
			this.logListener = Objects.requireNonNull(logListener, "logListener must not be null");
			return this;
		}

		@Nonnull
		public Builder onError(@Nonnull Consumer<String> errorListener) {
			this.errorListener = Objects.requireNonNull(errorListener, "errorListener must not be null");
			return this;
		}

		/**
		 * Routes the log callback to {@link Log#info} and the error callback to {@link Log#error}.
		 *
		 * @param log Maven log
		 * @return this builder
		 */
		@Nonnull
		public Builder log(@Nonnull Log log) {
			Objects.requireNonNull(log, "log must not be null");
			this.logListener = log::info;
			this.errorListener = log::error;
			return this;
		}

		@Nonnull
		public RunOptions build() {
			return new RunOptions(this);
		}
	}
}
