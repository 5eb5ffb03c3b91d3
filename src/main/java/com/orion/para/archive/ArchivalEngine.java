package com.orion.para.archive;

import com.orion.para.AppLogger;
import com.orion.para.ParaErrorCode;
import com.orion.para.index.CategoryIndexUpdater;
import com.orion.para.index.EntityType;
import com.orion.para.models.ArchiveIndex;
import com.orion.para.models.ArchivedItem;
import com.orion.para.models.AreaMeta;
import com.orion.para.models.ProjectMeta;
import com.orion.para.storage.ParaFileSystem;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Moves completed projects and dormant areas into the archive.
 *
 * Layout: {@code <root>/Archive/<projects|areas>/<YYYY-MM>/<dirname>}, bucketed
 * by the entity's {@code updated_at} in UTC. The directory moves with a single
 * rename. If the archive index cannot be updated afterwards the move is
 * reversed, so an archived directory is always listed in the index.
 */
public class ArchivalEngine {

    public static final String ARCHIVE_DIR = "Archive";

    private static final DateTimeFormatter YEAR_MONTH = DateTimeFormatter.ofPattern("yyyy-MM", Locale.ROOT);

    private final ParaFileSystem fileSystem;
    private final String rootName;
    private final ArchiveIndexStore indexStore;
    private final CategoryIndexUpdater categoryIndexUpdater;
    private final Clock clock;
    private final AppLogger logger = AppLogger.get();

    public ArchivalEngine(ParaFileSystem fileSystem, String rootName, ArchiveIndexStore indexStore,
                          CategoryIndexUpdater categoryIndexUpdater, Clock clock) {
        this.fileSystem = fileSystem;
        this.rootName = rootName;
        this.indexStore = indexStore;
        this.categoryIndexUpdater = categoryIndexUpdater;
        this.clock = clock;
    }

    public static boolean canArchiveProject(ProjectMeta project) {
        return project != null && "completed".equals(project.getStatus());
    }

    public static boolean canArchiveArea(AreaMeta area) {
        return area != null && "dormant".equals(area.getStatus());
    }

    /**
     * Archive destination relative to the namespace root, e.g.
     * {@code Archive/projects/2026-01/my-project}.
     */
    public static String archivePathFor(String itemType, String dirName, String updatedAt) {
        String subdir = ArchivedItem.TYPE_PROJECT.equals(itemType) ? "projects" : "areas";
        return ARCHIVE_DIR + "/" + subdir + "/" + yearMonthOf(updatedAt) + "/" + dirName;
    }

    static String yearMonthOf(String timestamp) {
        return OffsetDateTime.parse(timestamp).withOffsetSameInstant(ZoneOffset.UTC).format(YEAR_MONTH);
    }

    /**
     * @param originalPath project directory relative to the namespace root, e.g. {@code Projects/my-project}
     */
    public ArchiveResult archiveProject(ProjectMeta project, String originalPath) throws ArchiveException {
        if (!canArchiveProject(project)) {
            throw new ArchiveException(ParaErrorCode.NOT_ARCHIVABLE, String.format(
                "Project \"%s\" is not completed (status: %s)", nameOf(project), project != null ? project.getStatus() : null));
        }
        Candidate candidate = new Candidate(ArchivedItem.TYPE_PROJECT, EntityType.PROJECT, "Project",
            project.getId(), project.getName(), project.getUpdatedAt(), "completed");
        return archive(candidate, originalPath);
    }

    /**
     * @param originalPath area directory relative to the namespace root, e.g. {@code Areas/health}
     */
    public ArchiveResult archiveArea(AreaMeta area, String originalPath) throws ArchiveException {
        if (!canArchiveArea(area)) {
            throw new ArchiveException(ParaErrorCode.NOT_ARCHIVABLE, String.format(
                "Area \"%s\" is not dormant (status: %s)", nameOf(area), area != null ? area.getStatus() : null));
        }
        Candidate candidate = new Candidate(ArchivedItem.TYPE_AREA, EntityType.AREA, "Area",
            area.getId(), area.getName(), area.getUpdatedAt(), "inactive");
        return archive(candidate, originalPath);
    }

    private ArchiveResult archive(Candidate candidate, String originalPath) throws ArchiveException {
        String relative = relativeToRoot(originalPath);
        if (relative.isEmpty()) {
            throw new ArchiveException(ParaErrorCode.NOT_FOUND,
                candidate.label + " directory not found: " + originalPath);
        }
        String firstSegment = relative.split("/")[0];
        if (ARCHIVE_DIR.equalsIgnoreCase(firstSegment)) {
            throw new ArchiveException(ParaErrorCode.ALREADY_ARCHIVED,
                candidate.label + " \"" + candidate.name + "\" is already in the archive");
        }

        String dirName = relative.substring(relative.lastIndexOf('/') + 1);
        String archiveSubPath;
        try {
            archiveSubPath = archivePathFor(candidate.itemType, dirName, candidate.updatedAt);
        } catch (DateTimeParseException | NullPointerException e) {
            throw new ArchiveException(ParaErrorCode.NOT_ARCHIVABLE,
                candidate.label + " \"" + candidate.name + "\" has no valid updated_at: " + candidate.updatedAt, e);
        }
        String destination = rootName + "/" + archiveSubPath;
        String destinationParent = destination.substring(0, destination.lastIndexOf('/'));
        String source = rootName + "/" + relative;

        try {
            if (!fileSystem.exists(destinationParent)) {
                fileSystem.createDirectories(destinationParent);
            }
        } catch (IOException | RuntimeException e) {
            throw new ArchiveException(ParaErrorCode.FS_ERROR,
                "Failed to create archive directory " + destinationParent + ": " + AppLogger.describe(e), e);
        }

        try {
            if (!fileSystem.exists(source)) {
                throw new ArchiveException(ParaErrorCode.NOT_FOUND,
                    candidate.label + " directory not found: " + originalPath);
            }
            if (fileSystem.exists(destination)) {
                throw new ArchiveException(ParaErrorCode.FS_ERROR, "Archive destination already exists: " + destination);
            }
            fileSystem.rename(source, destination);
        } catch (IOException | RuntimeException e) {
            throw new ArchiveException(ParaErrorCode.FS_ERROR,
                "Failed to move " + source + " to " + destination + ": " + AppLogger.describe(e), e);
        }

        String archivedAt = Instant.now(clock).toString();
        try {
            ArchiveIndex index = indexStore.readForUpdate();
            ArchivedItem item = new ArchivedItem(candidate.id, candidate.itemType, relative, destination,
                archivedAt, candidate.reason);
            item.setTitle(candidate.name);
            index.append(item, Instant.now(clock).toString());
            indexStore.write(index);
        } catch (IOException | RuntimeException e) {
            ArchiveException failure = new ArchiveException(ParaErrorCode.FS_ERROR, "Failed to update archive index", e);
            rollback(destination, source, failure);
            throw failure;
        }

        logger.info("Archived " + source + " to " + destination);

        // Source index cleanup mirrors delete: best-effort once the archive index is committed.
        if (candidate.id != null) {
            try {
                categoryIndexUpdater.remove(candidate.sourceType, candidate.id);
            } catch (IOException | RuntimeException e) {
                logger.warn("Archived " + candidate.id + " but could not remove it from the "
                    + candidate.sourceType.getListKey() + " index", e);
            }
        }

        return new ArchiveResult(destination, archivedAt, relative);
    }

    private void rollback(String destination, String source, ArchiveException failure) {
        try {
            fileSystem.rename(destination, source);
            logger.error("Archive index update failed, moved " + destination + " back to " + source);
        } catch (IOException | RuntimeException e) {
            failure.addSuppressed(e);
            logger.error("Rollback failed: " + destination + " could not be moved back to " + source, e);
        }
    }

    private String relativeToRoot(String originalPath) {
        if (originalPath == null) {
            return "";
        }
        String path = originalPath.replaceAll("/+", "/").replaceAll("^/", "").replaceAll("/$", "");
        if (path.equals(rootName)) {
            return "";
        }
        if (path.startsWith(rootName + "/")) {
            return path.substring(rootName.length() + 1);
        }
        return path;
    }

    private static String nameOf(ProjectMeta project) {
        return project != null ? project.getName() : null;
    }

    private static String nameOf(AreaMeta area) {
        return area != null ? area.getName() : null;
    }

    private static final class Candidate {
        private final String itemType;
        private final EntityType sourceType;
        private final String label;
        private final String id;
        private final String name;
        private final String updatedAt;
        private final String reason;

        private Candidate(String itemType, EntityType sourceType, String label, String id, String name,
                          String updatedAt, String reason) {
            this.itemType = itemType;
            this.sourceType = sourceType;
            this.label = label;
            this.id = id;
            this.name = name;
            this.updatedAt = updatedAt;
            this.reason = reason;
        }
    }
}
