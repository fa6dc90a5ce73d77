package fun.fengwk.lss.cli.search;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Search CLI entry point, runs one search over the configured reading list and exits.
 *
 * @author fengwk
 */
@SpringBootApplication(scanBasePackages = "fun.fengwk.lss")
public class CliSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(CliSearchApplication.class, args);
    }

}
