package com.dcaswap.domain;

import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed atomic updates for schedules.
 */
@Repository
@RequiredArgsConstructor
public class ScheduleRepositoryImpl implements ScheduleRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Optional<Schedule> claimNextDue(Instant now, Instant staleLockBefore) {
        Query query = new Query(where("disabled").ne(true)
                .and("nextRunAt").lte(now)
                .orOperator(
                        where("lockedAt").is(null),
                        where("lockedAt").lt(staleLockBefore)))
                .with(Sort.by(Sort.Direction.ASC, "nextRunAt"));
        Update update = new Update()
                .set("lockedAt", now)
                .set("lastRunAt", now);
        Schedule claimed = mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), Schedule.class);
        return Optional.ofNullable(claimed);
    }

    @Override
    public boolean updateAppVersion(String scheduleId, int version) {
        UpdateResult result = mongoTemplate.updateFirst(
                new Query(where("_id").is(scheduleId)),
                new Update().set("app.version", version),
                Schedule.class);
        return result.getMatchedCount() > 0;
    }

    @Override
    public void markFinished(String scheduleId, ScheduleRunStatus status, String failReason,
                             Instant finishedAt, Instant nextRunAt) {
        Update update = new Update()
                .unset("lockedAt")
                .set("lastFinishedAt", finishedAt)
                .set("lastRunStatus", status)
                .set("nextRunAt", nextRunAt);
        if (status == ScheduleRunStatus.FAILED) {
            update.set("failReason", failReason).inc("failCount", 1);
        } else {
            update.unset("failReason");
        }
        mongoTemplate.updateFirst(new Query(where("_id").is(scheduleId)), update, Schedule.class);
    }

    @Override
    public void releaseLock(String scheduleId) {
        mongoTemplate.updateFirst(new Query(where("_id").is(scheduleId)), new Update().unset("lockedAt"), Schedule.class);
    }

    @Override
    public boolean setDisabled(String scheduleId, boolean disabled, Instant updatedAt) {
        UpdateResult result = mongoTemplate.updateFirst(
                new Query(where("_id").is(scheduleId)),
                new Update().set("disabled", disabled).set("updatedAt", updatedAt),
                Schedule.class);
        return result.getMatchedCount() > 0;
    }

    @Override
    public boolean applyEdit(String scheduleId, ScheduleEdit edit, Instant updatedAt) {
        Update update = new Update()
                .set("name", edit.name())
                .set("purchaseAmount", edit.purchaseAmount())
                .set("purchaseIntervalHuman", edit.purchaseIntervalHuman())
                .set("tokenIn", edit.tokenIn())
                .set("tokenOut", edit.tokenOut())
                .set("updatedAt", updatedAt);
        UpdateResult result = mongoTemplate.updateFirst(new Query(where("_id").is(scheduleId)), update, Schedule.class);
        if (result.getMatchedCount() == 0) {
            return false;
        }
        mongoTemplate.updateFirst(
                new Query(where("_id").is(scheduleId).and("nextRunAt").is(null)),
                new Update().set("nextRunAt", updatedAt),
                Schedule.class);
        return true;
    }
}
