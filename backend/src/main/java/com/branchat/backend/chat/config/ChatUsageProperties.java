package com.branchat.backend.chat.config;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.chat.usage")
public class ChatUsageProperties {

  /** Number of usage records retained in memory. Oldest records are evicted first. */
  private int capacity = 10_000;

  /** Pricing applied to models without an explicit entry in {@link #pricing}. */
  private Pricing defaultPricing =
      new Pricing(new BigDecimal("0.0015"), new BigDecimal("0.002"));

  /** Per-model pricing keyed by model identifier. */
  private Map<String, Pricing> pricing = new LinkedHashMap<>();

  public int getCapacity() {
    return capacity;
  }

  public void setCapacity(int capacity) {
    this.capacity = capacity;
  }

  public Pricing getDefaultPricing() {
    return defaultPricing;
  }

  public void setDefaultPricing(Pricing defaultPricing) {
    this.defaultPricing = defaultPricing;
  }

  public Map<String, Pricing> getPricing() {
    return pricing;
  }

  public void setPricing(Map<String, Pricing> pricing) {
    this.pricing = pricing;
  }

  public Pricing pricingFor(String model) {
    if (model != null && pricing != null && pricing.containsKey(model)) {
      return pricing.get(model);
    }
    return defaultPricing;
  }

  public static class Pricing {
    private BigDecimal inputPer1KTokens = BigDecimal.ZERO;
    private BigDecimal outputPer1KTokens = BigDecimal.ZERO;

    public Pricing() {}

    public Pricing(BigDecimal inputPer1KTokens, BigDecimal outputPer1KTokens) {
      this.inputPer1KTokens = inputPer1KTokens;
      this.outputPer1KTokens = outputPer1KTokens;
    }

    public BigDecimal getInputPer1KTokens() {
      return inputPer1KTokens;
    }

    public void setInputPer1KTokens(BigDecimal inputPer1KTokens) {
      this.inputPer1KTokens = inputPer1KTokens;
    }

    public BigDecimal getOutputPer1KTokens() {
      return outputPer1KTokens;
    }

    public void setOutputPer1KTokens(BigDecimal outputPer1KTokens) {
      this.outputPer1KTokens = outputPer1KTokens;
    }
  }
}
