package com.eyelevel.documentanalysis.service.extraction;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component("visionExtractionRetryListener")
public class VisionExtractionRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        if (context.getRetryCount() > 0) {
            log.warn("Vision extraction failed on attempt {}. Retrying... Error: {}", context.getRetryCount(),
                     throwable.getMessage());
        }
    }
}
