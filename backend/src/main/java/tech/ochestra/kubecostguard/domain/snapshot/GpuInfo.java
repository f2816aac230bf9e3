package tech.ochestra.kubecostguard.domain.snapshot;

/**
 * GPUs advertised by a node: device count and model key (e.g. "nvidia-tesla-t4").
 */
public record GpuInfo(int count, String model) {
}
