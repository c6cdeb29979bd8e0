package org.projectstate.codec;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Live document state: page geometry, navigation and per-page bookkeeping.
 * Page-keyed data is held in insertion-ordered maps and sets keyed by page number.
 */
public final class DocumentState {

    private String url;
    private String fileType;
    private int numPages;
    private int currentPage = 1;
    private double scale = 1.0;
    private double pageWidth;
    private double pageHeight;
    private boolean documentLoaded;
    private boolean loading;
    private String error = "";
    private Map<Integer, Boolean> pageTranslated = new LinkedHashMap<>();
    private Map<Integer, String> detectedPageBackgrounds = new LinkedHashMap<>();
    private Set<Integer> deletedPages = new LinkedHashSet<>();
    private String finalLayoutUrl;
    private int finalLayoutCurrentPage = 1;
    private Set<Integer> finalLayoutDeletedPages = new LinkedHashSet<>();

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getFileType() { return fileType; }
    public void setFileType(String fileType) { this.fileType = fileType; }

    public int getNumPages() { return numPages; }
    public void setNumPages(int numPages) { this.numPages = numPages; }

    public int getCurrentPage() { return currentPage; }
    public void setCurrentPage(int currentPage) { this.currentPage = currentPage; }

    public double getScale() { return scale; }
    public void setScale(double scale) { this.scale = scale; }

    public double getPageWidth() { return pageWidth; }
    public void setPageWidth(double pageWidth) { this.pageWidth = pageWidth; }

    public double getPageHeight() { return pageHeight; }
    public void setPageHeight(double pageHeight) { this.pageHeight = pageHeight; }

    public boolean isDocumentLoaded() { return documentLoaded; }
    public void setDocumentLoaded(boolean documentLoaded) { this.documentLoaded = documentLoaded; }

    public boolean isLoading() { return loading; }
    public void setLoading(boolean loading) { this.loading = loading; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    public Map<Integer, Boolean> getPageTranslated() { return pageTranslated; }
    public void setPageTranslated(Map<Integer, Boolean> pageTranslated) { this.pageTranslated = pageTranslated; }

    public Map<Integer, String> getDetectedPageBackgrounds() { return detectedPageBackgrounds; }
    public void setDetectedPageBackgrounds(Map<Integer, String> detectedPageBackgrounds) {
        this.detectedPageBackgrounds = detectedPageBackgrounds;
    }

    public Set<Integer> getDeletedPages() { return deletedPages; }
    public void setDeletedPages(Set<Integer> deletedPages) { this.deletedPages = deletedPages; }

    public String getFinalLayoutUrl() { return finalLayoutUrl; }
    public void setFinalLayoutUrl(String finalLayoutUrl) { this.finalLayoutUrl = finalLayoutUrl; }

    public int getFinalLayoutCurrentPage() { return finalLayoutCurrentPage; }
    public void setFinalLayoutCurrentPage(int finalLayoutCurrentPage) {
        this.finalLayoutCurrentPage = finalLayoutCurrentPage;
    }

    public Set<Integer> getFinalLayoutDeletedPages() { return finalLayoutDeletedPages; }
    public void setFinalLayoutDeletedPages(Set<Integer> finalLayoutDeletedPages) {
        this.finalLayoutDeletedPages = finalLayoutDeletedPages;
    }
}
