package org.oralhistory.rag.chat;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Central configuration wiring the chat components together. It exposes toggles
 * that decide whether deterministic or real OpenAI and database components
 * should be used.
 */
@Configuration
@EnableConfigurationProperties({ OpenAiClientProperties.class, RetrievalProperties.class })
public class ChatConfiguration {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService retrievalExecutor(RetrievalProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getFanOutParallelism()));
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CorpusStore corpusStore(RetrievalProperties properties, ResourceLoader resourceLoader,
            ObjectProvider<ObjectMapper> objectMapper) {
        CorpusLoader loader = new CorpusLoader(objectMapper.getIfAvailable(ObjectMapper::new));
        return loader.load(resourceLoader.getResource(properties.getEmbeddingsLocation()),
                resourceLoader.getResource(properties.getMetadataLocation()));
    }

    @Bean
    @ConditionalOnProperty(name = "rag.chat.mock-embeddings", havingValue = "true", matchIfMissing = true)
    public EmbeddingProvider deterministicEmbeddingProvider(RetrievalProperties properties, CorpusStore corpusStore) {
        DeterministicEmbeddingProvider provider = new DeterministicEmbeddingProvider(
                properties.getEmbeddingDimensions());
        provider.checkCompatibleWith(corpusStore);
        return provider;
    }

    @Bean
    @ConditionalOnProperty(name = "rag.chat.mock-embeddings", havingValue = "false")
    public EmbeddingProvider openAiEmbeddingProvider(ObjectProvider<RestClient.Builder> restClientBuilder,
            OpenAiClientProperties properties) {
        return new OpenAiEmbeddingProvider(restClientBuilder.getIfAvailable(RestClient::builder), properties);
    }

    @Bean
    @ConditionalOnProperty(name = "rag.chat.mock-openai", havingValue = "true", matchIfMissing = true)
    public LlmClient mockLlmClient() {
        return new MockLlmClient();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.chat.mock-openai", havingValue = "false")
    public LlmClient openAiLlmClient(ObjectProvider<RestClient.Builder> restClientBuilder,
            OpenAiClientProperties properties) {
        return new OpenAiLlmClient(restClientBuilder.getIfAvailable(RestClient::builder), properties);
    }

    @Bean
    public ContextRetriever contextRetriever(CorpusStore corpusStore, EmbeddingProvider embeddingProvider,
            RetrievalProperties properties, ExecutorService retrievalExecutor) {
        return new InterviewContextRetriever(corpusStore,
                new QueryReformulator(properties.getHistoryTurns(), properties.getShortQuestionLength()),
                new EntityResolver(corpusStore),
                new SimilarityRanker(corpusStore, embeddingProvider, properties.getTopK()),
                retrievalExecutor);
    }

    @Bean
    @ConditionalOnMissingBean
    public ChatSessionStore chatSessionStore() {
        return new ChatSessionStore();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.chat.mock-chat-log", havingValue = "true", matchIfMissing = true)
    public ChatLogRepository inMemoryChatLogRepository() {
        return new InMemoryChatLogRepository();
    }

    @Bean
    @ConditionalOnProperty(name = "rag.chat.mock-chat-log", havingValue = "false")
    public ChatLogRepository jdbcChatLogRepository(JdbcClient jdbcClient) {
        JdbcChatLogRepository repository = new JdbcChatLogRepository(jdbcClient);
        repository.createTableIfMissing();
        return repository;
    }

    @Bean
    public ChatService chatService(ContextRetriever contextRetriever, LlmClient llmClient,
            ChatSessionStore chatSessionStore, ChatLogRepository chatLogRepository,
            @Value("${rag.chat.chatbot-id:direct-answers-bot}") String chatbotId, Clock clock) {
        return new ChatService(contextRetriever, llmClient, chatSessionStore, chatLogRepository, chatbotId, clock);
    }
}
