package com.branchat.backend.chat.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.chat.stream")
public class ChatStreamProperties {

  /**
   * Interval between heartbeat events sent to every connected client. Zero or a negative value
   * disables heartbeats.
   */
  private Duration heartbeatInterval = Duration.ofSeconds(30);

  /**
   * When enabled, text accumulated before a provider error is stored as an assistant message. By
   * default nothing is persisted for a failed generation.
   */
  private boolean persistPartialOnError = false;

  public Duration getHeartbeatInterval() {
    return heartbeatInterval;
  }

  public void setHeartbeatInterval(Duration heartbeatInterval) {
    this.heartbeatInterval = heartbeatInterval;
  }

  public boolean isPersistPartialOnError() {
    return persistPartialOnError;
  }

  public void setPersistPartialOnError(boolean persistPartialOnError) {
    this.persistPartialOnError = persistPartialOnError;
  }
}
