package com.vectorpipeline.runtime;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private ProjectConfig project = new ProjectConfig();
    private FilterConfig filters = new FilterConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private SparseConfig sparse = new SparseConfig();
    private ResourceNames resourceNames = new ResourceNames();
    private BatchPaths batchPaths = new BatchPaths();
    private IndexDefaults indexDefaults = new IndexDefaults();
    private SearchConfig search = new SearchConfig();
    private StorageConfig storage = new StorageConfig();

    public ProjectConfig getProject() {
        return project;
    }

    public void setProject(ProjectConfig project) {
        this.project = project == null ? new ProjectConfig() : project;
    }

    public FilterConfig getFilters() {
        return filters;
    }

    public void setFilters(FilterConfig filters) {
        this.filters = filters == null ? new FilterConfig() : filters;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public SparseConfig getSparse() {
        return sparse;
    }

    public void setSparse(SparseConfig sparse) {
        this.sparse = sparse == null ? new SparseConfig() : sparse;
    }

    public ResourceNames getResourceNames() {
        return resourceNames;
    }

    public void setResourceNames(ResourceNames resourceNames) {
        this.resourceNames = resourceNames == null ? new ResourceNames() : resourceNames;
    }

    public BatchPaths getBatchPaths() {
        return batchPaths;
    }

    public void setBatchPaths(BatchPaths batchPaths) {
        this.batchPaths = batchPaths == null ? new BatchPaths() : batchPaths;
    }

    public IndexDefaults getIndexDefaults() {
        return indexDefaults;
    }

    public void setIndexDefaults(IndexDefaults indexDefaults) {
        this.indexDefaults = indexDefaults == null ? new IndexDefaults() : indexDefaults;
    }

    public SearchConfig getSearch() {
        return search;
    }

    public void setSearch(SearchConfig search) {
        this.search = search == null ? new SearchConfig() : search;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProjectConfig {
        private String projectId = "";
        private String region = "us-central1";

        public String getProjectId() {
            return projectId;
        }

        public void setProjectId(String projectId) {
            this.projectId = projectId;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FilterConfig {
        private List<String> restrictsFields = List.of();
        private List<String> numericRestrictsFields = List.of();
        private List<String> timestampFields = List.of("created_at", "updated_at");
        private String timestampZone = "UTC";

        public List<String> getRestrictsFields() {
            return restrictsFields;
        }

        public void setRestrictsFields(List<String> restrictsFields) {
            this.restrictsFields = restrictsFields == null ? List.of() : restrictsFields;
        }

        public List<String> getNumericRestrictsFields() {
            return numericRestrictsFields;
        }

        public void setNumericRestrictsFields(List<String> numericRestrictsFields) {
            this.numericRestrictsFields = numericRestrictsFields == null ? List.of() : numericRestrictsFields;
        }

        public List<String> getTimestampFields() {
            return timestampFields;
        }

        public void setTimestampFields(List<String> timestampFields) {
            this.timestampFields = timestampFields == null ? List.of("created_at", "updated_at") : timestampFields;
        }

        public String getTimestampZone() {
            return timestampZone;
        }

        public void setTimestampZone(String timestampZone) {
            this.timestampZone = timestampZone == null ? "UTC" : timestampZone;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String modelName = "gemini-embedding-001";
        private int outputDimensionality = 768;
        private List<String> textFields = List.of();
        private List<String> metadataFields = List.of();

        public String getModelName() {
            return modelName;
        }

        public void setModelName(String modelName) {
            this.modelName = modelName;
        }

        public int getOutputDimensionality() {
            return outputDimensionality;
        }

        public void setOutputDimensionality(int outputDimensionality) {
            this.outputDimensionality = outputDimensionality;
        }

        public List<String> getTextFields() {
            return textFields;
        }

        public void setTextFields(List<String> textFields) {
            this.textFields = textFields == null ? List.of() : textFields;
        }

        public List<String> getMetadataFields() {
            return metadataFields;
        }

        public void setMetadataFields(List<String> metadataFields) {
            this.metadataFields = metadataFields == null ? List.of() : metadataFields;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SparseConfig {
        private boolean enabled = false;
        private int bucketCount = 65536;
        private double k1 = 1.2;
        private double b = 0.75;
        private int workerThreads = 1;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getBucketCount() {
            return bucketCount;
        }

        public void setBucketCount(int bucketCount) {
            this.bucketCount = bucketCount;
        }

        public double getK1() {
            return k1;
        }

        public void setK1(double k1) {
            this.k1 = k1;
        }

        public double getB() {
            return b;
        }

        public void setB(double b) {
            this.b = b;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResourceNames {
        private String indexId = "";
        private String endpointId = "";
        private String deployedIndexId = "";

        public String getIndexId() {
            return indexId;
        }

        public void setIndexId(String indexId) {
            this.indexId = indexId;
        }

        public String getEndpointId() {
            return endpointId;
        }

        public void setEndpointId(String endpointId) {
            this.endpointId = endpointId;
        }

        public String getDeployedIndexId() {
            return deployedIndexId;
        }

        public void setDeployedIndexId(String deployedIndexId) {
            this.deployedIndexId = deployedIndexId;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BatchPaths {
        private String batchRoot = "";

        public String getBatchRoot() {
            return batchRoot;
        }

        public void setBatchRoot(String batchRoot) {
            this.batchRoot = batchRoot;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IndexDefaults {
        private String distanceMeasureType = "DOT_PRODUCT";

        public String getDistanceMeasureType() {
            return distanceMeasureType;
        }

        public void setDistanceMeasureType(String distanceMeasureType) {
            this.distanceMeasureType = distanceMeasureType;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SearchConfig {
        private int defaultTopK = 10;
        private int metadataScanThreads = 1;

        public int getDefaultTopK() {
            return defaultTopK;
        }

        public void setDefaultTopK(int defaultTopK) {
            this.defaultTopK = defaultTopK;
        }

        public int getMetadataScanThreads() {
            return metadataScanThreads;
        }

        public void setMetadataScanThreads(int metadataScanThreads) {
            this.metadataScanThreads = metadataScanThreads;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String blobRoot = ".vectorpipe/blobs";
        private String indexPath = ".vectorpipe/vector-index.json";
        private String tableDir = ".vectorpipe/tables";

        public String getBlobRoot() {
            return blobRoot;
        }

        public void setBlobRoot(String blobRoot) {
            this.blobRoot = blobRoot;
        }

        public String getIndexPath() {
            return indexPath;
        }

        public void setIndexPath(String indexPath) {
            this.indexPath = indexPath;
        }

        public String getTableDir() {
            return tableDir;
        }

        public void setTableDir(String tableDir) {
            this.tableDir = tableDir;
        }
    }
}
