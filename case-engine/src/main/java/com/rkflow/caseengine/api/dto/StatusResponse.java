package com.rkflow.caseengine.api.dto;

import com.rkflow.caseengine.status.StatusCatalog;
import com.rkflow.caseengine.status.StatusMeta;

import java.util.Locale;

/**
 * One row of the status catalog, as listed by GET /cases/statuses.
 * round and totalRounds are null outside the interview rounds.
 */
public record StatusResponse(String name, int level, String stage, Integer round, Integer totalRounds) {

    public static StatusResponse of(String name) {
        StatusMeta meta = StatusCatalog.metaOf(name);
        return new StatusResponse(
                name,
                StatusCatalog.levelOf(name),
                meta.stage().name().toLowerCase(Locale.ROOT),
                meta.round(),
                meta.totalRounds());
    }
}
