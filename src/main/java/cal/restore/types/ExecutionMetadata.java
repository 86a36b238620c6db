package cal.restore.types;

public record ExecutionMetadata(int progress, RestoreStage stage) {
}
