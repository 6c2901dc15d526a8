package org.caureq.hostwatch.service.alerts;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.hostwatch.config.AppProps;
import org.caureq.hostwatch.domain.CheckType;
import org.caureq.hostwatch.repo.CheckTypeRepo;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/** Inserts a catalog entry with default parameters for each implemented kind that has none. */
@Slf4j
@Component
@RequiredArgsConstructor
public class CheckCatalogSeeder implements ApplicationRunner {
    private final AppProps props;
    private final CheckRegistry registry;
    private final CheckTypeRepo checkTypeRepo;
    private final CheckConfigResolver resolver;

    @Override
    public void run(ApplicationArguments args) {
        if (!props.alertsOrDefault().seedOn()) return;
        int added = seed();
        if (added > 0) log.info("[Alerts] seeded {} check type(s)", added);
    }

    public int seed() {
        int added = 0;
        for (var e : registry.all()) {
            if (checkTypeRepo.findByCheckKey(e.kind()).isPresent()) continue;
            checkTypeRepo.save(CheckType.builder()
                    .checkKey(e.kind())
                    .name(e.displayName())
                    .params(resolver.toJson(e.defaultParams()))
                    .severity(e.defaultSeverity())
                    .cooldownMinutes(60)
                    .enabled(true)
                    .build());
            added++;
        }
        return added;
    }
}
