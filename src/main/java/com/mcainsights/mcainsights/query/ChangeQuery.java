package com.mcainsights.mcainsights.query;

import java.time.LocalDate;

/**
 * Commands understood by {@link ChangeQueryInterpreter}. A null date means the latest recorded run;
 * a null state or field means no filter.
 */
public sealed interface ChangeQuery {

    record NewIncorporations(String state, LocalDate date) implements ChangeQuery {
    }

    record Deregistrations(String state, LocalDate date) implements ChangeQuery {
    }

    record FieldUpdates(String fieldName, LocalDate date) implements ChangeQuery {
    }

    record EntityHistory(String entityKey) implements ChangeQuery {
    }

    record EntityProfile(String entityKey) implements ChangeQuery {
    }

    record ChangeCounts(LocalDate date) implements ChangeQuery {
    }
}
