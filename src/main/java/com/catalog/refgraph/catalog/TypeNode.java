package com.catalog.refgraph.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.catalog.refgraph.api.DataRecord;
import com.catalog.refgraph.api.ManagedData;

/**
 * Node of the catalog's category tree.
 *
 * <p>
 * A <b>folder</b> node groups types under a category and has no type of its
 * own; its record count is the sum of its children. A <b>type</b> node holds
 * the records of one record type.
 */
public final class TypeNode {
    public static final String DEFAULT_CATEGORY = "Other";

    private static final String[] STRIPPED_SUFFIXES = { "Definition", "Config", "ConfigSO", "SO", "Data", "Base" };

    private final String displayName;
    private final Class<?> type;
    private final List<TypeNode> children = new ArrayList<>();
    private final List<DataRecord> records;
    private int recordCount;
    private boolean expanded;

    /** Creates a folder node. */
    public TypeNode(String displayName) {
        this.displayName = displayName;
        this.type = null;
        this.records = List.of();
        this.expanded = true;
    }

    /** Creates a type node. */
    public TypeNode(Class<?> type, List<DataRecord> records) {
        this.type = Objects.requireNonNull(type, "type");
        this.displayName = displayNameOf(type);
        this.records = records == null ? List.of() : Collections.unmodifiableList(records);
        this.recordCount = this.records.size();
    }

    public void addChild(TypeNode child) {
        if (child == null)
            return;
        children.add(child);
        updateRecordCount();
    }

    /** Recomputes the count; folders sum their children recursively. */
    public void updateRecordCount() {
        if (isFolder()) {
            int total = 0;
            for (TypeNode child : children) {
                child.updateRecordCount();
                total += child.recordCount;
            }
            recordCount = total;
        } else {
            recordCount = records.size();
        }
    }

    public boolean isFolder() {
        return type == null;
    }

    public String displayName() {
        return displayName;
    }

    /** The record type, or null for folders. */
    public Class<?> type() {
        return type;
    }

    public List<TypeNode> children() {
        return Collections.unmodifiableList(children);
    }

    public List<DataRecord> records() {
        return records;
    }

    public int recordCount() {
        return recordCount;
    }

    public boolean isExpanded() {
        return expanded;
    }

    public void setExpanded(boolean expanded) {
        this.expanded = expanded;
    }

    @Override
    public String toString() {
        return displayName + " (" + recordCount + ")";
    }

    /**
     * Display name of a record type: {@link ManagedData#displayName()} if set,
     * otherwise the simple name with the first matching common suffix removed.
     */
    public static String displayNameOf(Class<?> type) {
        ManagedData managed = type.getAnnotation(ManagedData.class);
        if (managed != null && !managed.displayName().isBlank())
            return managed.displayName();

        String name = type.getSimpleName();
        for (String suffix : STRIPPED_SUFFIXES) {
            if (name.endsWith(suffix) && name.length() > suffix.length())
                return name.substring(0, name.length() - suffix.length());
        }
        return name;
    }

    /** Category of a record type: {@link ManagedData#category()} or {@code Other}. */
    public static String categoryOf(Class<?> type) {
        ManagedData managed = type == null ? null : type.getAnnotation(ManagedData.class);
        if (managed != null && !managed.category().isBlank())
            return managed.category();
        return DEFAULT_CATEGORY;
    }

    /**
     * Groups record types into category folders.
     *
     * <p>
     * Member, local, anonymous and generic types are left out of the tree.
     * Folders are sorted by display name; types keep the order of
     * {@code recordsByType}.
     */
    public static List<TypeNode> buildCategoryTree(Map<Class<?>, List<DataRecord>> recordsByType) {
        Map<String, TypeNode> folders = new LinkedHashMap<>();
        for (Map.Entry<Class<?>, List<DataRecord>> entry : recordsByType.entrySet()) {
            Class<?> type = entry.getKey();
            if (type.getEnclosingClass() != null || type.isAnonymousClass() || type.getTypeParameters().length > 0)
                continue;
            TypeNode folder = folders.computeIfAbsent(categoryOf(type), TypeNode::new);
            folder.addChild(new TypeNode(type, entry.getValue()));
        }

        List<TypeNode> roots = new ArrayList<>(folders.values());
        for (TypeNode root : roots)
            root.updateRecordCount();
        roots.sort(Comparator.comparing(TypeNode::displayName));
        return roots;
    }
}
