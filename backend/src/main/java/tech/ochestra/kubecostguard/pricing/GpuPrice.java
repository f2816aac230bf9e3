package tech.ochestra.kubecostguard.pricing;

/**
 * Resolved GPU price of a node.
 *
 * @param pricePerDevice hourly price per device after the region multiplier, 0 when unrecognized
 * @param recognized     false when the model is missing from the pricing table
 */
public record GpuPrice(String model, int count, double pricePerDevice, boolean recognized) {

    public double hourlyCost() {
        return pricePerDevice * count;
    }
}
