package com.work.escrow.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * freelancer 提交的交付内容（纯链下字段）。
 */
public final class MilestoneSubmission {

    private final String description;
    private final List<String> links;
    private final List<String> fileReferences;

    public MilestoneSubmission(String description, List<String> links, List<String> fileReferences) {
        this.description = description;
        this.links = links == null ? Collections.emptyList() : Collections.unmodifiableList(links);
        this.fileReferences = fileReferences == null ? Collections.emptyList() : Collections.unmodifiableList(fileReferences);
    }

    public String getDescription() {
        return description;
    }

    public List<String> getLinks() {
        return links;
    }

    public List<String> getFileReferences() {
        return fileReferences;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MilestoneSubmission)) return false;
        MilestoneSubmission that = (MilestoneSubmission) o;
        return Objects.equals(description, that.description)
                && links.equals(that.links)
                && fileReferences.equals(that.fileReferences);
    }

    @Override
    public int hashCode() {
        return Objects.hash(description, links, fileReferences);
    }
}
