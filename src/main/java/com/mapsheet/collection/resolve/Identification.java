package com.mapsheet.collection.resolve;

import com.mapsheet.collection.core.model.FileCategory;
import com.mapsheet.collection.core.model.WorkUnitIdentity;

import java.time.LocalDate;

/**
 * Work unit, category and file-name date recognized in a file name, without any
 * judgement about the active collection period.
 */
public record Identification(WorkUnitIdentity identity, FileCategory category, LocalDate fileDate) {
}
