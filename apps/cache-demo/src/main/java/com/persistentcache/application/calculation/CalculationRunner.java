package com.persistentcache.application.calculation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 애플리케이션 시작 시 계산을 실행하는 러너.
 * <p>
 * {@code --n=<값>} 인자로 입력 값을 지정할 수 있습니다. 기본값은 10입니다.
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "cache-demo.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CalculationRunner implements ApplicationRunner {

    private static final long DEFAULT_INPUT = 10L;

    private final CalculationService calculationService;

    @Override
    public void run(ApplicationArguments args) {
        long n = inputOf(args);
        log.info("addTwo({}) = {}", n, calculationService.addTwo(n));
        log.info("fibonacci({}) = {}", n, calculationService.fibonacci(n));
    }

    private long inputOf(ApplicationArguments args) {
        List<String> values = args.getOptionValues("n");
        if (values == null || values.isEmpty()) {
            return DEFAULT_INPUT;
        }
        return Long.parseLong(values.get(0));
    }
}
