package fun.fengwk.lss.core.service.search.progress;

import lombok.extern.slf4j.Slf4j;

/**
 * Logs progress at every tenth of the run and on completion.
 *
 * @author fengwk
 */
@Slf4j
public class LoggingProgressListener implements ProgressListener {

    private final String label;

    public LoggingProgressListener(String label) {
        this.label = label;
    }

    @Override
    public void onProgress(int completed, int total) {
        int step = Math.max(1, total / 10);
        if (completed == total || completed % step == 0) {
            log.info("{}: {}/{} ({}%)", label, completed, total, total == 0 ? 100 : completed * 100 / total);
        } else {
            log.debug("{}: {}/{}", label, completed, total);
        }
    }

}
