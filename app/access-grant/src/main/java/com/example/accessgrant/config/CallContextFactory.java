package com.example.accessgrant.config;

import com.example.accessgrant.model.CallContext;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** API リクエストごとに設定済みの期限付き CallContext を作る。 */
@Component
@RequiredArgsConstructor
public class CallContextFactory {

  private final Clock clock;
  private final AccessGrantProperties properties;

  public CallContext forRequest() {
    return CallContext.withTimeout(clock, properties.requestTimeout());
  }
}
