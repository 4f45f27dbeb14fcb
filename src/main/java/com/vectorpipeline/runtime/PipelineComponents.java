package com.vectorpipeline.runtime;

import java.io.IOException;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.LinkedHashSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vectorpipeline.index.DatapointLoader;
import com.vectorpipeline.index.DistanceMeasure;
import com.vectorpipeline.index.IndexUpdateService;
import com.vectorpipeline.index.LocalJsonVectorIndex;
import com.vectorpipeline.ingest.DatapointAssembler;
import com.vectorpipeline.ingest.EmbeddingJob;
import com.vectorpipeline.ingest.EmbeddingService;
import com.vectorpipeline.ingest.EmbeddingServices;
import com.vectorpipeline.ingest.FieldSelection;
import com.vectorpipeline.ingest.JsonLinesRecordSource;
import com.vectorpipeline.ingest.RecordProjector;
import com.vectorpipeline.ingest.SparseEncoder;
import com.vectorpipeline.ingest.TimestampParser;
import com.vectorpipeline.search.MetadataBackfill;
import com.vectorpipeline.search.ResultMerger;
import com.vectorpipeline.search.SearchService;
import com.vectorpipeline.storage.LocalBlobStore;

import okhttp3.OkHttpClient;

/**
 * Wires the pipeline from an {@link AppConfig}. The local vector index is loaded once and written
 * back by {@link #saveIndex()}.
 */
public final class PipelineComponents {
    private static final Logger log = LoggerFactory.getLogger(PipelineComponents.class);

    private final Path indexPath;
    private final LocalJsonVectorIndex index;
    private final EmbeddingJob embeddingJob;
    private final IndexUpdateService indexUpdateService;
    private final SearchService searchService;

    private PipelineComponents(Path indexPath,
            LocalJsonVectorIndex index,
            EmbeddingJob embeddingJob,
            IndexUpdateService indexUpdateService,
            SearchService searchService) {
        this.indexPath = indexPath;
        this.index = index;
        this.embeddingJob = embeddingJob;
        this.indexUpdateService = indexUpdateService;
        this.searchService = searchService;
    }

    public static PipelineComponents create(AppConfig config, ObjectMapper mapper, OkHttpClient httpClient)
            throws IOException {
        EmbeddingService embeddingService = EmbeddingServices.fromEnvironment(
                httpClient,
                mapper,
                config.getEmbedding().getModelName(),
                config.getEmbedding().getOutputDimensionality());
        return create(config, mapper, embeddingService);
    }

    public static PipelineComponents create(AppConfig config, ObjectMapper mapper, EmbeddingService embeddingService)
            throws IOException {
        LocalBlobStore blobStore = new LocalBlobStore(Path.of(config.getStorage().getBlobRoot()));
        DatapointAssembler assembler = new DatapointAssembler(mapper, embeddingService.dimension());
        AppConfig.SparseConfig sparse = config.getSparse();
        SparseEncoder sparseEncoder = new SparseEncoder(sparse.getBucketCount(), sparse.getK1(), sparse.getB(),
                sparse.getWorkerThreads());

        AppConfig.FilterConfig filters = config.getFilters();
        FieldSelection fields = new FieldSelection(
                config.getEmbedding().getTextFields(),
                config.getEmbedding().getMetadataFields(),
                filters.getRestrictsFields(),
                filters.getNumericRestrictsFields(),
                new LinkedHashSet<>(filters.getTimestampFields()));
        RecordProjector projector = new RecordProjector(fields, new TimestampParser(ZoneId.of(filters.getTimestampZone())));

        Path indexPath = Path.of(config.getStorage().getIndexPath());
        DistanceMeasure measure = DistanceMeasure.fromName(config.getIndexDefaults().getDistanceMeasureType());
        LocalJsonVectorIndex index = LocalJsonVectorIndex.load(indexPath, measure, mapper);
        log.debug("Pipeline wired measure={} embedding={} sparseEnabled={} indexSize={}",
                measure, embeddingService.version(), sparse.isEnabled(), index.size());

        String batchRoot = config.getBatchPaths().getBatchRoot();
        EmbeddingJob embeddingJob = new EmbeddingJob(
                new JsonLinesRecordSource(Path.of(config.getStorage().getTableDir()), mapper),
                embeddingService,
                sparse.isEnabled() ? sparseEncoder : null,
                projector,
                assembler,
                blobStore,
                batchRoot);
        IndexUpdateService indexUpdateService = new IndexUpdateService(
                index,
                new DatapointLoader(blobStore, assembler),
                assembler,
                config.getResourceNames().getIndexId(),
                batchRoot);
        SearchService searchService = new SearchService(
                embeddingService,
                sparseEncoder,
                index,
                new ResultMerger(mapper),
                new MetadataBackfill(blobStore, mapper, config.getSearch().getMetadataScanThreads()),
                new SearchService.Defaults(
                        config.getSearch().getDefaultTopK(),
                        config.getResourceNames().getEndpointId(),
                        config.getResourceNames().getDeployedIndexId(),
                        batchRoot));
        return new PipelineComponents(indexPath, index, embeddingJob, indexUpdateService, searchService);
    }

    public EmbeddingJob embeddingJob() {
        return embeddingJob;
    }

    public IndexUpdateService indexUpdateService() {
        return indexUpdateService;
    }

    public SearchService searchService() {
        return searchService;
    }

    public LocalJsonVectorIndex index() {
        return index;
    }

    public void saveIndex() throws IOException {
        index.save(indexPath);
        log.info("Saved {} datapoints to {}", index.size(), indexPath);
    }
}
