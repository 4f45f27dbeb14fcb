package com.vectorpipeline;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.vectorpipeline.index.StreamingUpdateRequest;
import com.vectorpipeline.ingest.EmbeddingRequest;
import com.vectorpipeline.runtime.AppConfig;
import com.vectorpipeline.runtime.ConfigLoader;
import com.vectorpipeline.runtime.PipelineComponents;
import com.vectorpipeline.runtime.PipelineException;
import com.vectorpipeline.search.SearchRequest;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "vector-pipeline",
        mixinStandardHelpOptions = true,
        version = "vector-pipeline 0.1.0",
        description = "Embeds tabular records, maintains a vector index and searches it.")
public class Main implements Callable<Integer> {
    static final int EXIT_INPUT_ERROR = 2;
    static final int EXIT_PIPELINE_FAILURE = 3;

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    Path configPath;

    @Option(names = "--mode", required = true, description = "Execution mode: ${COMPLETION-CANDIDATES}")
    Mode mode;

    @Option(names = "--table", description = "Table to embed (embed mode)")
    String table;

    @Option(names = "--where", description = "Row filter: TRUE or field = 'value'", defaultValue = "TRUE")
    String where;

    @Option(names = "--output-prefix", description = "gs:// prefix for the embedding output; defaults to batchPaths.batchRoot")
    String outputPrefix;

    @Option(names = "--dimension", description = "Expected embedding dimension")
    Integer dimension;

    @Option(names = "--index-id", description = "Index id; defaults to resourceNames.indexId")
    String indexId;

    @Option(names = "--source", description = "Datapoint source for stream-update: api or gcs", defaultValue = "api")
    String source;

    @Option(names = "--datapoints-file", description = "JSON array of datapoints (stream-update with source api)")
    Path datapointsFile;

    @Option(names = "--datapoints-prefix", description = "gs:// prefix of datapoint files (stream-update with source gcs)")
    String datapointsPrefix;

    @Option(names = "--ids", split = ",", description = "Datapoint ids to delete")
    List<String> ids = new ArrayList<>();

    @Option(names = "--contents-delta-uri", description = "gs:// prefix for batch update; defaults to batchPaths.batchRoot")
    String contentsDeltaUri;

    @Option(names = "--complete-overwrite", description = "Replace the whole index on batch update", defaultValue = "false")
    boolean completeOverwrite;

    @Option(names = "--query", description = "Query text, or a JSON array of numbers for vector queries")
    String query;

    @Option(names = "--query-type", description = "text or vector", defaultValue = "text")
    String queryType;

    @Option(names = "--top-k", description = "Neighbors to return; defaults to search.defaultTopK")
    Integer topK;

    @Option(names = "--hybrid", description = "Combine dense and sparse ranking", defaultValue = "false")
    boolean hybrid;

    @Option(names = "--restricts", description = "JSON array of namespace filters")
    String restricts;

    @Option(names = "--metadata-prefix", description = "gs:// prefix scanned for missing metadata")
    String metadataPrefix;

    @Option(names = "--endpoint-id", description = "Index endpoint id; defaults to resourceNames.endpointId")
    String endpointId;

    @Option(names = "--deployed-index-id", description = "Deployed index id; defaults to resourceNames.deployedIndexId")
    String deployedIndexId;

    private final ObjectMapper mapper = new ObjectMapper();
    private final OkHttpClient httpClient = new OkHttpClient();

    enum Mode {
        embed,
        stream_update,
        stream_delete,
        batch_update,
        search
    }

    public static void main(String[] args) {
        int exitCode = newCommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    static CommandLine newCommandLine(Main main) {
        CommandLine commandLine = new CommandLine(main);
        commandLine.registerConverter(Mode.class, value -> Mode.valueOf(value.replace('-', '_')));
        return commandLine;
    }

    @Override
    public Integer call() throws Exception {
        log.info("Starting vector-pipeline in {} mode", mode);
        log.info("Using config file: {}", configPath);
        try {
            AppConfig config = ConfigLoader.load(configPath);
            log.info("Project projectId={} region={} index={} endpoint={}",
                    config.getProject().getProjectId(),
                    config.getProject().getRegion(),
                    config.getResourceNames().getIndexId(),
                    config.getResourceNames().getEndpointId());
            PipelineComponents components = PipelineComponents.create(config, mapper, httpClient);
            Object report = run(components);
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
            return 0;
        } catch (IllegalArgumentException | FileNotFoundException e) {
            log.error("Invalid input for {}: {}", mode, e.getMessage());
            return EXIT_INPUT_ERROR;
        } catch (PipelineException e) {
            log.error("{} failed at stage {}", mode, e.stage(), e);
            return EXIT_PIPELINE_FAILURE;
        } catch (IOException e) {
            log.error("{} failed", mode, e);
            return EXIT_PIPELINE_FAILURE;
        }
    }

    private Object run(PipelineComponents components) throws IOException {
        switch (mode) {
            case embed:
                return components.embeddingJob().run(new EmbeddingRequest(table, where, outputPrefix, dimension));
            case stream_update: {
                Object report = components.indexUpdateService().streamingUpdate(
                        new StreamingUpdateRequest(indexId, source, readDatapoints(), datapointsPrefix));
                components.saveIndex();
                return report;
            }
            case stream_delete: {
                Object report = components.indexUpdateService().streamingDelete(indexId, ids);
                components.saveIndex();
                return report;
            }
            case batch_update: {
                Object report = components.indexUpdateService().batchUpdate(indexId, contentsDeltaUri, completeOverwrite);
                components.saveIndex();
                return report;
            }
            case search:
                return components.searchService().search(new SearchRequest(
                        queryType,
                        parseQuery(),
                        topK,
                        hybrid,
                        restricts == null ? null : readJson(restricts, "--restricts"),
                        metadataPrefix,
                        endpointId,
                        deployedIndexId));
            default:
                throw new IllegalArgumentException("Unsupported mode " + mode);
        }
    }

    private List<JsonNode> readDatapoints() throws IOException {
        List<JsonNode> datapoints = new ArrayList<>();
        if (datapointsFile == null) {
            return datapoints;
        }
        JsonNode root = mapper.readTree(Files.readString(datapointsFile));
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("--datapoints-file must contain a JSON array");
        }
        root.forEach(datapoints::add);
        return datapoints;
    }

    private JsonNode parseQuery() {
        if (query == null) {
            return null;
        }
        if ("vector".equalsIgnoreCase(queryType)) {
            return readJson(query, "--query");
        }
        return TextNode.valueOf(query);
    }

    private JsonNode readJson(String value, String option) {
        try {
            return mapper.readTree(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(option + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
