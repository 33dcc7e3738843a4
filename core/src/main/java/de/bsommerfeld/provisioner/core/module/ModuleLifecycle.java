package de.bsommerfeld.provisioner.core.module;

import java.util.Optional;

/**
 * Capability table of a module: one optional slot per lifecycle stage.
 *
 * <p>
 * Built once at registration. The execution layer asks the table which
 * stages exist instead of probing the module at runtime; an empty slot is
 * treated as an automatic success.
 *
 * <pre>
 * ModuleLifecycle lifecycle = ModuleLifecycle.builder()
 *         .validate(ctx -&gt; StageResult.of(aptAvailable(), "apt not found"))
 *         .configure(this::install)
 *         .verify(this::verify)
 *         .build();
 * </pre>
 */
public final class ModuleLifecycle {

    private final LifecycleStage validate;
    private final LifecycleStage preConfigure;
    private final LifecycleStage configure;
    private final LifecycleStage postConfigure;
    private final LifecycleStage verify;

    private ModuleLifecycle(Builder builder) {
        this.validate = builder.validate;
        this.preConfigure = builder.preConfigure;
        this.configure = builder.configure;
        this.postConfigure = builder.postConfigure;
        this.verify = builder.verify;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A lifecycle without any stage. Every stage reports as skipped. */
    public static ModuleLifecycle empty() {
        return builder().build();
    }

    public Optional<LifecycleStage> validate() {
        return Optional.ofNullable(validate);
    }

    public Optional<LifecycleStage> preConfigure() {
        return Optional.ofNullable(preConfigure);
    }

    public Optional<LifecycleStage> configure() {
        return Optional.ofNullable(configure);
    }

    public Optional<LifecycleStage> postConfigure() {
        return Optional.ofNullable(postConfigure);
    }

    public Optional<LifecycleStage> verify() {
        return Optional.ofNullable(verify);
    }

    public static final class Builder {

        private LifecycleStage validate;
        private LifecycleStage preConfigure;
        private LifecycleStage configure;
        private LifecycleStage postConfigure;
        private LifecycleStage verify;

        private Builder() {
        }

        public Builder validate(LifecycleStage stage) {
            this.validate = stage;
            return this;
        }

        public Builder preConfigure(LifecycleStage stage) {
            this.preConfigure = stage;
            return this;
        }

        public Builder configure(LifecycleStage stage) {
            this.configure = stage;
            return this;
        }

        public Builder postConfigure(LifecycleStage stage) {
            this.postConfigure = stage;
            return this;
        }

        public Builder verify(LifecycleStage stage) {
            this.verify = stage;
            return this;
        }

        public ModuleLifecycle build() {
            return new ModuleLifecycle(this);
        }
    }
}
