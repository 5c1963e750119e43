package com.mapsheet.collection.core.model;

/**
 * The submission kinds every work unit delivers each collection period.
 */
public enum FileCategory {
    /**
     * Observation points and tracks finished in the field.
     */
    FINISHED_OBSERVATIONS("finished_points_and_tracks", "Finished points"),

    /**
     * Routes planned for the coming field day.
     */
    PLANNED_ROUTES("plan_routes", "Planned routes");

    private final String fileToken;
    private final String folderName;

    FileCategory(String fileToken, String folderName) {
        this.fileToken = fileToken;
        this.folderName = folderName;
    }

    /**
     * Token used between the identifier and the date in canonical file names.
     */
    public String fileToken() {
        return fileToken;
    }

    /**
     * Name of the archive sub-folder holding files of this category.
     */
    public String folderName() {
        return folderName;
    }
}
