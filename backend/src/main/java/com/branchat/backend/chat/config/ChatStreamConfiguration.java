package com.branchat.backend.chat.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Enables the auto-configured task scheduler used for stream heartbeats. */
@Configuration
@EnableScheduling
public class ChatStreamConfiguration {}
