package datadog.segment.core.propagation;

import datadog.segment.api.TracePropagationStyle;

/** Extracts nothing and injects nothing, for when propagation is disabled. */
class NoneCodec {

  public static final HttpCodec.Injector INJECTOR =
      new HttpCodec.Injector() {
        @Override
        public <C> void inject(InjectionContext context, C carrier, CarrierSetter<C> setter) {}
      };

  public static final HttpCodec.Extractor EXTRACTOR =
      new HttpCodec.Extractor() {
        @Override
        public TracePropagationStyle style() {
          return TracePropagationStyle.NONE;
        }

        @Override
        public ExtractedContext extract(HeaderLookup headers) {
          return new ExtractedContext(TracePropagationStyle.NONE);
        }
      };

  private NoneCodec() {}
}
