package dao.tron.twallet.scheduler;

import dao.tron.twallet.config.WorkerProperties;
import org.springframework.stereotype.Component;

/**
 * Builds workers from {@code worker.*} configuration and runs them in a configured mode.
 */
@Component
public class WorkerFactory {

    private final WorkerProperties workerProps;

    public WorkerFactory(WorkerProperties workerProps) {
        this.workerProps = workerProps;
    }

    public <T> Worker<T> newWorker() {
        Integer lanes = workerProps.getLanes();
        return lanes == null ? new Worker<>() : new Worker<>(lanes);
    }

    public void run(Worker<?> worker, WorkerProperties.Batching batching) {
        switch (batching.getMode()) {
            case LANES -> worker.run();
            case ALL_JOINED -> worker.runAllJoined();
            case SINGLE_THREADED -> {
                if (batching.getBatchSize() == null) {
                    worker.runSingleThreaded();
                } else {
                    worker.runSingleThreaded(batching.getBatchSize());
                }
            }
        }
    }
}
