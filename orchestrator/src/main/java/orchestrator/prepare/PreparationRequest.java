package orchestrator.prepare;

import java.nio.file.Path;

/**
 * What to build and synchronize when preparing a prefix's package repository.
 * Every source is optional; an absent one contributes no job.
 */
public final class PreparationRequest {

    private final Path rpmRepo;
    private final Path reposyncYumConfig;
    private final boolean skipSync;
    private final Path vdsmDir;
    private final Path engineDir;
    private final boolean engineBuildGwt;
    private final Path vdsmJsonrpcJavaDir;

    private PreparationRequest(Builder b) {
        this.rpmRepo = b.rpmRepo;
        this.reposyncYumConfig = b.reposyncYumConfig;
        this.skipSync = b.skipSync;
        this.vdsmDir = b.vdsmDir;
        this.engineDir = b.engineDir;
        this.engineBuildGwt = b.engineBuildGwt;
        this.vdsmJsonrpcJavaDir = b.vdsmJsonrpcJavaDir;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Local directory of synchronized upstream repositories, or null. */
    public Path rpmRepo() { return rpmRepo; }

    /** Yum config naming the upstream repositories, or null. */
    public Path reposyncYumConfig() { return reposyncYumConfig; }

    public boolean skipSync() { return skipSync; }

    public Path vdsmDir() { return vdsmDir; }

    public Path engineDir() { return engineDir; }

    public boolean engineBuildGwt() { return engineBuildGwt; }

    public Path vdsmJsonrpcJavaDir() { return vdsmJsonrpcJavaDir; }

    @Override
    public String toString() {
        return "PreparationRequest{" +
                "rpmRepo=" + rpmRepo +
                ", reposyncYumConfig=" + reposyncYumConfig +
                ", skipSync=" + skipSync +
                ", vdsmDir=" + vdsmDir +
                ", engineDir=" + engineDir +
                ", engineBuildGwt=" + engineBuildGwt +
                ", vdsmJsonrpcJavaDir=" + vdsmJsonrpcJavaDir +
                '}';
    }

    public static final class Builder {
        private Path rpmRepo;
        private Path reposyncYumConfig;
        private boolean skipSync;
        private Path vdsmDir;
        private Path engineDir;
        private boolean engineBuildGwt;
        private Path vdsmJsonrpcJavaDir;

        private Builder() {}

        public Builder rpmRepo(Path rpmRepo) {
            this.rpmRepo = rpmRepo;
            return this;
        }

        public Builder reposyncYumConfig(Path config) {
            this.reposyncYumConfig = config;
            return this;
        }

        public Builder skipSync(boolean skipSync) {
            this.skipSync = skipSync;
            return this;
        }

        public Builder vdsmDir(Path dir) {
            this.vdsmDir = dir;
            return this;
        }

        public Builder engineDir(Path dir) {
            this.engineDir = dir;
            return this;
        }

        public Builder engineBuildGwt(boolean buildGwt) {
            this.engineBuildGwt = buildGwt;
            return this;
        }

        public Builder vdsmJsonrpcJavaDir(Path dir) {
            this.vdsmJsonrpcJavaDir = dir;
            return this;
        }

        public PreparationRequest build() {
            return new PreparationRequest(this);
        }
    }
}
