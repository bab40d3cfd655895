package org.oralhistory.rag.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.oralhistory.rag.chat.DeterministicEmbeddingProvider;
import org.oralhistory.rag.chat.EmbeddingProvider;
import org.oralhistory.rag.chat.OpenAiClientProperties;
import org.oralhistory.rag.chat.OpenAiEmbeddingProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Offline command building the embedding artifact from a folder of transcript
 * PDFs named {@code document<id>.pdf}.
 *
 * <pre>
 * java -cp interview-rag.jar org.oralhistory.rag.ingest.IngestCommand [--no-openai] &lt;pdf-folder&gt; &lt;embeddings.json&gt;
 * </pre>
 */
public final class IngestCommand {

    private static final Logger LOGGER = LoggerFactory.getLogger(IngestCommand.class);

    static final int DETERMINISTIC_DIMENSIONS = 1536;

    private IngestCommand() {
    }

    public static void main(String[] args) throws Exception {
        boolean noOpenAi = false;
        List<String> inputs = new ArrayList<>();
        for (String arg : args) {
            switch (arg) {
                case "--help", "-h" -> {
                    printHelp();
                    return;
                }
                case "--no-openai" -> noOpenAi = true;
                default -> inputs.add(arg);
            }
        }
        if (inputs.size() != 2) {
            printHelp();
            System.exit(2);
        }
        String apiKey = System.getenv("OPENAI_API_KEY");
        if (!noOpenAi && (apiKey == null || apiKey.isBlank())) {
            System.err.println("No OPENAI_API_KEY set. Use --no-openai or export OPENAI_API_KEY.");
            System.exit(1);
        }

        Path folder = Paths.get(inputs.get(0));
        Path output = Paths.get(inputs.get(1));
        if (!Files.isDirectory(folder)) {
            System.err.println("Not a folder: " + folder);
            System.exit(2);
        }

        EmbeddingProvider embeddingProvider = noOpenAi
                ? new DeterministicEmbeddingProvider(DETERMINISTIC_DIMENSIONS)
                : openAiProvider(apiKey);
        ExecutorService executor = Executors.newFixedThreadPool(BatchEmbedder.DEFAULT_BATCH_SIZE);
        try {
            run(folder, output, embeddingProvider, executor);
        } finally {
            executor.shutdown();
        }
    }

    static void run(Path folder, Path output, EmbeddingProvider embeddingProvider, ExecutorService executor)
            throws IOException {
        List<TranscriptDocument> documents = new TranscriptPdfReader().readFolder(folder);
        LOGGER.info("Found {} documents", documents.size());

        TranscriptChunker chunker = new TranscriptChunker(TranscriptChunker.DEFAULT_MAX_TOKENS);
        List<TranscriptChunk> chunks = new ArrayList<>();
        documents.forEach(document -> chunks.addAll(chunker.split(document)));
        LOGGER.info("Created {} chunks", chunks.size());

        BatchEmbedder embedder = new BatchEmbedder(embeddingProvider, BatchEmbedder.DEFAULT_BATCH_SIZE,
                BatchEmbedder.DEFAULT_PAUSE, executor);
        new CorpusArtifactWriter(new ObjectMapper()).write(embedder.embedAll(chunks), output);
        LOGGER.info("Embedding generation complete");
    }

    private static EmbeddingProvider openAiProvider(String apiKey) {
        OpenAiClientProperties properties = new OpenAiClientProperties();
        properties.setApiKey(apiKey);
        return new OpenAiEmbeddingProvider(RestClient.builder(), properties);
    }

    private static void printHelp() {
        System.out.println("""
                Usage: IngestCommand [options] <pdf-folder> <embeddings.json>

                Options:
                  --no-openai   : deterministic embeddings, no OPENAI_API_KEY needed
                  -h, --help    : show this help
                """);
    }
}
