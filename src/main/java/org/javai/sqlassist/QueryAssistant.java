package org.javai.sqlassist;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.javai.sqlassist.config.AssistantSettings;
import org.javai.sqlassist.config.ChatClientFactory;
import org.javai.sqlassist.config.GenerationSettings;
import org.javai.sqlassist.generate.ChatClientQueryGenerator;
import org.javai.sqlassist.generate.FallbackQueryGenerator;
import org.javai.sqlassist.generate.GeneratedQuery;
import org.javai.sqlassist.generate.PatternQueryGenerator;
import org.javai.sqlassist.generate.QueryGenerator;
import org.javai.sqlassist.generate.RemoteQueryGenerator;
import org.javai.sqlassist.prompt.SchemaContextRenderer;
import org.javai.sqlassist.schema.Documentation;
import org.javai.sqlassist.schema.SchemaCatalog;
import org.javai.sqlassist.session.ConnectionSnapshot;
import org.javai.sqlassist.validate.QueryValidator;
import org.javai.sqlassist.validate.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Entry point for translating questions into SQL and assessing the result.
 *
 * <pre>{@code
 * QueryAssistant assistant = QueryAssistant.builder()
 *     .withChatClient(chatClient)          // optional; without it only the pattern generator runs
 *     .build();
 *
 * QueryAnswer answer = assistant.ask("How many users signed up last month?", holder.current());
 * }</pre>
 *
 * <p>Stateless and thread-safe. Callers pass the schema and documentation with every call, normally
 * from a single {@link ConnectionSnapshot}.</p>
 */
public final class QueryAssistant {

	private static final Logger logger = LoggerFactory.getLogger(QueryAssistant.class);
	private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

	private final QueryGenerator generator;
	private final QueryValidator validator;

	private QueryAssistant(Builder builder) {
		this.generator = builder.buildGenerator();
		this.validator = builder.validator != null ? builder.validator : new QueryValidator();
	}

	public static Builder builder() {
		return new Builder();
	}

	public String renderContext(SchemaCatalog schema, Documentation documentation) {
		return SchemaContextRenderer.render(schema, documentation);
	}

	public GeneratedQuery generateQuery(String question, SchemaCatalog schema, Documentation documentation) {
		return generator.generate(question, schema, documentation);
	}

	public ValidationResult validateQuery(String question, String query, SchemaCatalog schema) {
		return validator.validate(question, query, schema);
	}

	/**
	 * Generates and validates in one step against a single snapshot.
	 */
	public QueryAnswer ask(String question, ConnectionSnapshot snapshot) {
		ConnectionSnapshot effective = snapshot != null ? snapshot : ConnectionSnapshot.disconnected();
		SchemaCatalog schema = effective.schemaOrEmpty();
		GeneratedQuery generated = generateQuery(question, schema, effective.documentation());
		ValidationResult validation = validateQuery(question, generated.query(), schema);
		logger.debug("Answered with {} query, confidence {}", generated.method().wireName(), validation.confidence());
		return new QueryAnswer(generated.query(), generated.method(), validation);
	}

	public static String toJson(QueryAnswer answer) {
		try {
			return JSON_MAPPER.writeValueAsString(Objects.requireNonNull(answer, "answer must not be null"));
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialise answer", e);
		}
	}

	public static final class Builder {
		private AssistantSettings settings = AssistantSettings.defaults();
		private ChatClient chatClient;
		private Function<GenerationSettings, Optional<ChatClient>> chatClientSource;
		private RemoteQueryGenerator remoteGenerator;
		private QueryGenerator fallbackGenerator;
		private QueryValidator validator;

		private Builder() {
		}

		public Builder withSettings(AssistantSettings settings) {
			this.settings = settings != null ? settings : AssistantSettings.defaults();
			return this;
		}

		/**
		 * Enables remote generation through the given client.
		 */
		public Builder withChatClient(ChatClient chatClient) {
			this.chatClient = chatClient;
			return this;
		}

		/**
		 * Enables remote generation with the OpenAI key from the environment, when one is set.
		 * The client is created by {@link #build()} with the generation settings in force then.
		 */
		public Builder withChatClientFromEnvironment() {
			return withChatClientSource(ChatClientFactory::fromEnvironment);
		}

		/**
		 * Creates the chat client at {@link #build()} time from the final generation settings.
		 * An explicit {@link #withChatClient(ChatClient)} takes precedence.
		 */
		Builder withChatClientSource(Function<GenerationSettings, Optional<ChatClient>> chatClientSource) {
			this.chatClientSource = chatClientSource;
			return this;
		}

		/**
		 * Uses a custom remote generator instead of the {@link ChatClient} based one.
		 */
		public Builder withRemoteGenerator(RemoteQueryGenerator remoteGenerator) {
			this.remoteGenerator = remoteGenerator;
			return this;
		}

		public Builder withFallbackGenerator(QueryGenerator fallbackGenerator) {
			this.fallbackGenerator = fallbackGenerator;
			return this;
		}

		public Builder withValidator(QueryValidator validator) {
			this.validator = validator;
			return this;
		}

		public QueryAssistant build() {
			return new QueryAssistant(this);
		}

		private QueryGenerator buildGenerator() {
			RemoteQueryGenerator remote = remoteGenerator;
			ChatClient client = chatClient;
			if (remote == null && client == null && chatClientSource != null) {
				client = chatClientSource.apply(settings.generation()).orElse(null);
			}
			if (remote == null && client != null) {
				remote = new ChatClientQueryGenerator(client, settings.generation());
			}
			QueryGenerator fallback = fallbackGenerator != null ? fallbackGenerator : new PatternQueryGenerator();
			return new FallbackQueryGenerator(remote, fallback);
		}
	}
}
