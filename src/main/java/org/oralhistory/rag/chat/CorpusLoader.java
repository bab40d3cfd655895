package org.oralhistory.rag.chat;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

/**
 * Builds a {@link CorpusStore} from the embedding artifact and the interview
 * metadata table. Loading is all-or-nothing: any inconsistency results in a
 * {@link CorpusLoadException}.
 */
public class CorpusLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(CorpusLoader.class);

    static final Pattern SOURCE_PATTERN = Pattern.compile("document(\\d+)\\.pdf");

    private static final String NAME_COLUMN = "name";
    private static final String DATE_COLUMN = "date";
    private static final String TITLE_COLUMN = "excerpt_title";
    private static final String TAGS_COLUMN = "tags";

    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper;

    public CorpusLoader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.csvMapper = CsvMapper.builder().enable(CsvParser.Feature.SKIP_EMPTY_LINES).build();
    }

    public CorpusStore load(Resource artifact, Resource metadataTable) {
        try (InputStream artifactStream = artifact.getInputStream();
                InputStream metadataStream = metadataTable.getInputStream()) {
            return load(artifactStream, metadataStream);
        } catch (IOException ex) {
            throw new CorpusLoadException("Unable to read corpus from " + artifact.getDescription() + " and "
                    + metadataTable.getDescription(), ex);
        }
    }

    public CorpusStore load(InputStream artifactStream, InputStream metadataStream) {
        List<PersonRecord> records = readRecords(metadataStream);
        CorpusArtifact artifact = readArtifact(artifactStream);
        List<Chunk> chunks = toChunks(artifact);

        CorpusStore store = new CorpusStore(chunks, records);
        for (Chunk chunk : chunks) {
            if (store.record(chunk.documentId()).isEmpty()) {
                throw new CorpusLoadException("Chunk " + chunk.position() + " references " + chunk.sourceFileName()
                        + " which has no metadata row");
            }
        }
        LOGGER.info("Loaded {} embeddings and {} metadata records", chunks.size(), records.size());
        return store;
    }

    private CorpusArtifact readArtifact(InputStream stream) {
        try {
            CorpusArtifact artifact = objectMapper.readValue(stream, CorpusArtifact.class);
            if (artifact == null || artifact.embeddings() == null || artifact.texts() == null
                    || artifact.metadata() == null) {
                throw new CorpusLoadException("Corpus artifact must contain embeddings, texts and metadata arrays");
            }
            return artifact;
        } catch (IOException ex) {
            throw new CorpusLoadException("Malformed corpus artifact", ex);
        }
    }

    private List<Chunk> toChunks(CorpusArtifact artifact) {
        int size = artifact.embeddings().size();
        if (artifact.texts().size() != size || artifact.metadata().size() != size) {
            throw new CorpusLoadException(String.format(
                    "Corpus arrays differ in length: embeddings=%d, texts=%d, metadata=%d", size,
                    artifact.texts().size(), artifact.metadata().size()));
        }
        List<Chunk> chunks = new ArrayList<>(size);
        int dimensions = -1;
        for (int i = 0; i < size; i++) {
            float[] embedding = artifact.embeddings().get(i);
            String text = artifact.texts().get(i);
            CorpusArtifact.ChunkMetadata metadata = artifact.metadata().get(i);
            if (embedding == null || embedding.length == 0 || text == null || metadata == null) {
                throw new CorpusLoadException("Chunk " + i + " is incomplete");
            }
            if (dimensions < 0) {
                dimensions = embedding.length;
            } else if (embedding.length != dimensions) {
                throw new CorpusLoadException("Chunk " + i + " has " + embedding.length
                        + " dimensions, expected " + dimensions);
            }
            String documentId = documentIdOf(metadata.source());
            int tokens = metadata.tokens() == null ? 0 : metadata.tokens();
            chunks.add(new Chunk(i, text, metadata.source(), documentId, metadata.page(), tokens, embedding));
        }
        return chunks;
    }

    private List<PersonRecord> readRecords(InputStream stream) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<PersonRecord> records = new ArrayList<>();
        try (MappingIterator<Map<String, String>> rows = csvMapper.readerFor(Map.class).with(schema)
                .readValues(stream)) {
            int index = 0;
            while (rows.hasNext()) {
                Map<String, String> row = rows.next();
                if (!row.containsKey(NAME_COLUMN)) {
                    throw new CorpusLoadException("Metadata table has no '" + NAME_COLUMN + "' column");
                }
                index++;
                records.add(new PersonRecord(Integer.toString(index), valueOf(row, NAME_COLUMN),
                        valueOf(row, DATE_COLUMN), valueOf(row, TITLE_COLUMN), valueOf(row, TAGS_COLUMN)));
            }
        } catch (CorpusLoadException ex) {
            throw ex;
        } catch (IOException | RuntimeException ex) {
            throw new CorpusLoadException("Malformed metadata table", ex);
        }
        return records;
    }

    private static String valueOf(Map<String, String> row, String column) {
        String value = row.get(column);
        return value == null ? "" : value.trim();
    }

    /**
     * Extracts the bare document id from a transcript file name such as
     * {@code document12.pdf}.
     */
    static String documentIdOf(String sourceFileName) {
        if (sourceFileName == null) {
            throw new CorpusLoadException("Chunk metadata without source file name");
        }
        Matcher matcher = SOURCE_PATTERN.matcher(sourceFileName);
        if (!matcher.find()) {
            throw new CorpusLoadException("Source '" + sourceFileName + "' does not follow document<id>.pdf");
        }
        return matcher.group(1);
    }
}
