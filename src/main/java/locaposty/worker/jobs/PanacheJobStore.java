package locaposty.worker.jobs;

import io.quarkus.hibernate.orm.panache.Panache;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;
import locaposty.worker.data.models.DelayedJob;
import locaposty.worker.data.models.DelayedJob.JobStatus;
import locaposty.worker.exceptions.DuplicateJobException;
import locaposty.worker.exceptions.JobActiveException;
import org.hibernate.exception.ConstraintViolationException;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link JobStore} backed by the {@code delayed_jobs} table.
 *
 * <p>
 * Claims are conditional updates on a single row ({@code WHERE id = ? AND status = PENDING ...}); a row another worker
 * process claimed first simply updates zero rows, so several processes can share the table without row locks.
 */
@ApplicationScoped
public class PanacheJobStore implements JobStore {

    private static final Logger LOG = Logger.getLogger(PanacheJobStore.class);

    @Override
    @Transactional
    public Optional<DelayedJob> findById(Long jobId) {
        return DelayedJob.findByIdOptional(jobId);
    }

    @Override
    @Transactional
    public Optional<DelayedJob> findLive(String jobKey) {
        return DelayedJob.find("activeKey", jobKey).firstResultOptional();
    }

    @Override
    @Transactional
    public DelayedJob insert(NewJob newJob, Instant now) {
        if (findLive(newJob.jobKey()).isPresent()) {
            throw new DuplicateJobException(newJob.jobKey());
        }
        DelayedJob job = toEntity(newJob, now);
        try {
            job.persistAndFlush();
        } catch (PersistenceException e) {
            if (e instanceof ConstraintViolationException || e.getCause() instanceof ConstraintViolationException) {
                // lost a race with a concurrent insert for the same key
                throw new DuplicateJobException(newJob.jobKey(), e);
            }
            throw e;
        }
        LOG.infof("Created job %d (type: %s, key: %s, scheduled: %s)", job.id, job.jobType, job.jobKey,
                job.scheduledAt);
        return job;
    }

    @Override
    @Transactional
    public DelayedJob replacePending(NewJob newJob, Instant now) {
        Optional<DelayedJob> existing = findLive(newJob.jobKey());
        if (existing.isPresent()) {
            DelayedJob live = existing.get();
            if (live.status == JobStatus.PROCESSING) {
                throw new JobActiveException(newJob.jobKey());
            }
            live.delete();
            Panache.getEntityManager().flush();
            LOG.debugf("Removed pending job %d for replacement (key: %s)", live.id, live.jobKey);
        }
        return insert(newJob, now);
    }

    @Override
    @Transactional
    public boolean removePending(String jobKey) {
        return DelayedJob.delete("activeKey = ?1 and status = ?2", jobKey, JobStatus.PENDING) > 0;
    }

    @Override
    @Transactional
    public List<DelayedJob> claimReady(Instant now, Instant staleBefore, String workerId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<Long> candidates = Panache.getEntityManager()
                .createQuery("select j.id from DelayedJob j where (j.status = :pending and j.scheduledAt <= :now) "
                        + "or (j.status = :processing and j.lockedAt < :staleBefore) order by j.scheduledAt asc",
                        Long.class)
                .setParameter("pending", JobStatus.PENDING).setParameter("processing", JobStatus.PROCESSING)
                .setParameter("now", now).setParameter("staleBefore", staleBefore).setMaxResults(limit)
                .getResultList();

        List<DelayedJob> claimed = new ArrayList<>();
        for (Long id : candidates) {
            int updated = DelayedJob.update(
                    "status = ?1, lockedAt = ?2, lockedBy = ?3, attempts = attempts + 1, updatedAt = ?2 "
                            + "where id = ?4 and ((status = ?5 and scheduledAt <= ?2) "
                            + "or (status = ?1 and lockedAt < ?6))",
                    JobStatus.PROCESSING, now, workerId, id, JobStatus.PENDING, staleBefore);
            if (updated == 1) {
                DelayedJob.<DelayedJob> findByIdOptional(id).ifPresent(claimed::add);
            }
        }
        return claimed;
    }

    @Override
    @Transactional
    public boolean complete(Long jobId, String workerId, Instant now) {
        return DelayedJob.update(
                "status = ?1, activeKey = null, completedAt = ?2, updatedAt = ?2 "
                        + "where id = ?3 and status = ?4 and lockedBy = ?5",
                JobStatus.COMPLETED, now, jobId, JobStatus.PROCESSING, workerId) > 0;
    }

    @Override
    @Transactional
    public boolean retry(Long jobId, String workerId, Instant runAt, String error, Instant now) {
        return DelayedJob.update(
                "status = ?1, scheduledAt = ?2, lockedAt = null, lockedBy = null, lastError = ?3, updatedAt = ?4 "
                        + "where id = ?5 and status = ?6 and lockedBy = ?7",
                JobStatus.PENDING, runAt, error, now, jobId, JobStatus.PROCESSING, workerId) > 0;
    }

    @Override
    @Transactional
    public boolean fail(Long jobId, String workerId, String error, Instant now) {
        return DelayedJob.update(
                "status = ?1, activeKey = null, failedAt = ?2, lastError = ?3, updatedAt = ?2 "
                        + "where id = ?4 and status = ?5 and lockedBy = ?6",
                JobStatus.FAILED, now, error, jobId, JobStatus.PROCESSING, workerId) > 0;
    }

    @Override
    @Transactional
    public long countByStatus(JobStatus status) {
        return DelayedJob.count("status", status);
    }

    private static DelayedJob toEntity(NewJob newJob, Instant now) {
        DelayedJob job = new DelayedJob();
        job.jobKey = newJob.jobKey();
        job.activeKey = newJob.jobKey();
        job.jobType = newJob.type();
        job.subjectId = newJob.subjectId();
        job.requestedBy = newJob.requestedBy();
        job.status = JobStatus.PENDING;
        job.attempts = 0;
        job.maxAttempts = newJob.maxAttempts();
        job.scheduledAt = newJob.runAt();
        job.createdAt = now;
        job.updatedAt = now;
        return job;
    }
}
