package datadog.segment.common.sampling;

import datadog.segment.api.DDTags;
import datadog.segment.api.sampling.PrioritySampling;
import datadog.segment.api.sampling.SamplingMechanism;
import datadog.segment.core.SamplingDecision;
import datadog.segment.core.SpanData;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A rate sampler which maintains different sample rates per service+env name.
 *
 * <p>The configuration of (serviceName,env)->rate is configured by the core agent. Until the
 * agent answers, every trace is kept with the {@link SamplingMechanism#DEFAULT default} mechanism.
 */
public class RateByServiceTraceSampler implements TraceSampler {

  private static final Logger log = LoggerFactory.getLogger(RateByServiceTraceSampler.class);

  static final String RATE_BY_SERVICE = "rate_by_service";
  private static final double DEFAULT_RATE = 1.0;
  private static final DeterministicSampler DEFAULT_SAMPLER =
      new DeterministicSampler.TraceSampler(DEFAULT_RATE);

  private volatile RateSamplersByEnvAndService serviceRates = new RateSamplersByEnvAndService();

  @Override
  public SamplingDecision decide(final SpanData root) {
    final String serviceName = root.getServiceName();
    final String env = root.getTag(DDTags.ENV);

    DeterministicSampler sampler = serviceRates.getSampler(env == null ? "" : env, serviceName);
    int mechanism = SamplingMechanism.AGENT_RATE;
    if (sampler == null) {
      sampler = DEFAULT_SAMPLER;
      mechanism = SamplingMechanism.DEFAULT;
    }

    int priority =
        sampler.sample(root) ? PrioritySampling.SAMPLER_KEEP : PrioritySampling.SAMPLER_DROP;
    return SamplingDecision.local(priority, mechanism, sampler.getSampleRate());
  }

  @Override
  public void onResponse(
      final String endpoint, final Map<String, Map<String, Number>> responseJson) {
    final Map<String, Number> newServiceRates = responseJson.get(RATE_BY_SERVICE);

    if (null == newServiceRates) {
      return;
    }

    log.debug("Update service sampler rates: {} -> {}", endpoint, responseJson);
    final Map<String, DeterministicSampler> updatedServiceRates = new HashMap<>();

    DeterministicSampler fallbackSampler = null;
    for (final Map.Entry<String, Number> entry : newServiceRates.entrySet()) {
      if (entry.getValue() == null) {
        continue;
      }
      DeterministicSampler sampler = createRateSampler(entry.getValue().doubleValue());
      if (RateSamplersByEnvAndService.FALLBACK_KEY.equals(entry.getKey())) {
        fallbackSampler = sampler;
      } else {
        updatedServiceRates.put(entry.getKey(), sampler);
      }
    }
    serviceRates = new RateSamplersByEnvAndService(updatedServiceRates, fallbackSampler);
  }

  private static DeterministicSampler createRateSampler(final double sampleRate) {
    final double sanitizedRate;
    if (sampleRate < 0) {
      log.error("SampleRate is negative, disabling the sampler");
      sanitizedRate = 1;
    } else if (sampleRate > 1) {
      sanitizedRate = 1;
    } else {
      sanitizedRate = sampleRate;
    }

    return new DeterministicSampler.TraceSampler(sanitizedRate);
  }

  private static final class RateSamplersByEnvAndService {
    static final String FALLBACK_KEY = key("", "");

    private final Map<String, DeterministicSampler> serviceRates;
    private final DeterministicSampler fallbackSampler;

    RateSamplersByEnvAndService() {
      this(Collections.emptyMap(), null);
    }

    RateSamplersByEnvAndService(
        Map<String, DeterministicSampler> serviceRates, DeterministicSampler fallbackSampler) {
      this.serviceRates = serviceRates;
      this.fallbackSampler = fallbackSampler;
    }

    /** Returns {@code null} when the agent sent neither a matching nor a fallback rate. */
    DeterministicSampler getSampler(String env, String service) {
      DeterministicSampler sampler = serviceRates.get(key(service, env));
      return null == sampler ? fallbackSampler : sampler;
    }

    static String key(String service, String env) {
      return "service:" + service + ",env:" + env;
    }
  }
}
