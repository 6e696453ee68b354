package com.github.jsonldkit.core;

import com.github.jsonldkit.core.JsonLdConsts.Embed;

/**
 * http://www.w3.org/TR/json-ld11-api/#the-jsonldoptions-type
 *
 * @author tristan
 *
 */
public class JsonLdOptions {

    public static final int DEFAULT_MAX_CANONICALIZATION_STEPS = 100000;

    public JsonLdOptions() {
        this("");
    }

    public JsonLdOptions(String base) {
        this.setBase(base);
    }

    // Base options : http://www.w3.org/TR/json-ld11-api/#idl-def-JsonLdOptions

    private String base = null;
    private boolean compactArrays = true;
    private boolean compactToRelative = true;
    private Object expandContext = null;
    private String processingMode = JsonLdConsts.JSON_LD_1_1;
    private DocumentLoader documentLoader = new DocumentLoader();
    private boolean ordered = false;

    // Frame options : http://www.w3.org/TR/json-ld11-framing/

    private Embed embed = Embed.ONCE;
    private boolean explicit = false;
    private boolean omitDefault = false;
    private boolean omitGraph = false;
    private boolean requireAll = false;
    private boolean frameDefault = false;
    private boolean pruneBlankNodeIdentifiers = true;

    // RDF conversion options :
    // http://www.w3.org/TR/json-ld11-api/#serialize-rdf-as-json-ld-algorithm

    private boolean useRdfType = false;
    private boolean useNativeTypes = false;
    private boolean produceGeneralizedRdf = false;

    // Canonicalization and serialization options

    private String format = null;
    private String inputFormat = null;
    private String algorithm = JsonLdConsts.URDNA2015;
    private int maxCanonicalizationSteps = DEFAULT_MAX_CANONICALIZATION_STEPS;

    public JsonLdOptions copy() {
        final JsonLdOptions copy = new JsonLdOptions(base);
        copy.compactArrays = compactArrays;
        copy.compactToRelative = compactToRelative;
        copy.expandContext = expandContext;
        copy.processingMode = processingMode;
        copy.documentLoader = documentLoader;
        copy.ordered = ordered;
        copy.embed = embed;
        copy.explicit = explicit;
        copy.omitDefault = omitDefault;
        copy.omitGraph = omitGraph;
        copy.requireAll = requireAll;
        copy.frameDefault = frameDefault;
        copy.pruneBlankNodeIdentifiers = pruneBlankNodeIdentifiers;
        copy.useRdfType = useRdfType;
        copy.useNativeTypes = useNativeTypes;
        copy.produceGeneralizedRdf = produceGeneralizedRdf;
        copy.format = format;
        copy.inputFormat = inputFormat;
        copy.algorithm = algorithm;
        copy.maxCanonicalizationSteps = maxCanonicalizationSteps;
        return copy;
    }

    public boolean getCompactArrays() {
        return compactArrays;
    }

    public void setCompactArrays(boolean compactArrays) {
        this.compactArrays = compactArrays;
    }

    public boolean getCompactToRelative() {
        return compactToRelative;
    }

    public void setCompactToRelative(boolean compactToRelative) {
        this.compactToRelative = compactToRelative;
    }

    public Object getExpandContext() {
        return expandContext;
    }

    public void setExpandContext(Object expandContext) {
        this.expandContext = expandContext;
    }

    public String getProcessingMode() {
        return processingMode;
    }

    public void setProcessingMode(String processingMode) {
        this.processingMode = processingMode;
    }

    /**
     * True when the processing mode is not json-ld-1.0.
     */
    public boolean isProcessingMode11() {
        return !JsonLdConsts.JSON_LD_1_0.equals(processingMode);
    }

    public String getBase() {
        return base;
    }

    public void setBase(String base) {
        this.base = base;
    }

    public DocumentLoader getDocumentLoader() {
        return documentLoader;
    }

    public void setDocumentLoader(DocumentLoader documentLoader) {
        this.documentLoader = documentLoader;
    }

    public boolean isOrdered() {
        return ordered;
    }

    public void setOrdered(boolean ordered) {
        this.ordered = ordered;
    }

    public Embed getEmbed() {
        return embed;
    }

    public void setEmbed(Embed embed) {
        this.embed = embed;
    }

    /**
     * Accepts the JSON forms of @embed: a keyword string or a boolean.
     */
    public void setEmbed(Object embed) throws JsonLdError {
        this.embed = JsonLdApi.toEmbed(embed);
    }

    public boolean getExplicit() {
        return explicit;
    }

    public void setExplicit(boolean explicit) {
        this.explicit = explicit;
    }

    public boolean getOmitDefault() {
        return omitDefault;
    }

    public void setOmitDefault(boolean omitDefault) {
        this.omitDefault = omitDefault;
    }

    public boolean getOmitGraph() {
        return omitGraph;
    }

    public void setOmitGraph(boolean omitGraph) {
        this.omitGraph = omitGraph;
    }

    public boolean getRequireAll() {
        return requireAll;
    }

    public void setRequireAll(boolean requireAll) {
        this.requireAll = requireAll;
    }

    public boolean getFrameDefault() {
        return frameDefault;
    }

    public void setFrameDefault(boolean frameDefault) {
        this.frameDefault = frameDefault;
    }

    public boolean getPruneBlankNodeIdentifiers() {
        return pruneBlankNodeIdentifiers;
    }

    public void setPruneBlankNodeIdentifiers(boolean pruneBlankNodeIdentifiers) {
        this.pruneBlankNodeIdentifiers = pruneBlankNodeIdentifiers;
    }

    public boolean getUseRdfType() {
        return useRdfType;
    }

    public void setUseRdfType(boolean useRdfType) {
        this.useRdfType = useRdfType;
    }

    public boolean getUseNativeTypes() {
        return useNativeTypes;
    }

    public void setUseNativeTypes(boolean useNativeTypes) {
        this.useNativeTypes = useNativeTypes;
    }

    public boolean getProduceGeneralizedRdf() {
        return produceGeneralizedRdf;
    }

    public void setProduceGeneralizedRdf(boolean produceGeneralizedRdf) {
        this.produceGeneralizedRdf = produceGeneralizedRdf;
    }

    public String getFormat() {
        return format;
    }

    public void setFormat(String format) {
        this.format = format;
    }

    public String getInputFormat() {
        return inputFormat;
    }

    public void setInputFormat(String inputFormat) {
        this.inputFormat = inputFormat;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public void setAlgorithm(String algorithm) {
        this.algorithm = algorithm;
    }

    public int getMaxCanonicalizationSteps() {
        return maxCanonicalizationSteps;
    }

    public void setMaxCanonicalizationSteps(int maxCanonicalizationSteps) {
        this.maxCanonicalizationSteps = maxCanonicalizationSteps;
    }
}
