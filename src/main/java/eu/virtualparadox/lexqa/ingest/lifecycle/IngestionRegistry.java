package eu.virtualparadox.lexqa.ingest.lifecycle;

import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory registry of submitted ingestion jobs.
 */
@Service
public class IngestionRegistry {

    private final AtomicLong counter;
    private final Map<Long, IngestionJob> jobs;

    public IngestionRegistry() {
        this.counter = new AtomicLong(0);
        this.jobs = new ConcurrentHashMap<>();
    }

    public IngestionJob createJob(final String filename) {
        final long id = counter.incrementAndGet();
        final IngestionJob job = new IngestionJob(id, filename);
        jobs.put(id, job);
        return job;
    }

    public Optional<IngestionJob> getJob(final long id) {
        return Optional.ofNullable(jobs.get(id));
    }

    public List<IngestionJob> listJobs() {
        return jobs.values().stream()
                .sorted(Comparator.comparingLong(IngestionJob::getId))
                .toList();
    }

    /**
     * Drops finished jobs from the registry.
     *
     * @return number of jobs removed
     */
    public int purgeFinished() {
        final int before = jobs.size();
        jobs.values().removeIf(job -> job.getStatus().isTerminal());
        return before - jobs.size();
    }

    public ProgressStatus getProgressStatus() {
        long pages = 0;
        long done = 0;
        int documentPercent = 100;
        for (final IngestionJob job : listJobs()) {
            if (job.getStatus().isTerminal()) {
                continue;
            }
            pages += job.getPageCount();
            done += job.getPagesDone();
            if (job.getStatus() == EIngestionStatus.EXTRACTING) {
                documentPercent = job.percent();
            }
        }
        final int totalPercent = pages == 0 ? 100 : (int) ((done * 100L) / pages);
        return new ProgressStatus(totalPercent, documentPercent);
    }
}
