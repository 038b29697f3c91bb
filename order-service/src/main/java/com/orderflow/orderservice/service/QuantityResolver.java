package com.orderflow.orderservice.service;

import com.orderflow.orderservice.config.OrderflowProperties;
import com.orderflow.orderservice.exception.ManualChannelRequiredException;
import com.orderflow.orderservice.exception.QuantityUnsatisfiableException;
import com.orderflow.orderservice.model.Product;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns a customer's desired quantity into one the order can actually carry:
 * a multiple of the product's MOQ, no larger than the stock on hand or the
 * global per-line cap.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QuantityResolver {

    private final OrderflowProperties properties;

    /**
     * @return 0 when the line cannot be satisfied, otherwise a multiple of
     *         {@code moq} that is at most {@code min(stockAvailable, globalMax)}
     */
    public int resolve(int desiredQty, int moq, int stockAvailable, int globalMax) {
        int step = Math.max(1, moq);
        int hardCap = Math.min(Math.max(0, stockAvailable), globalMax);
        if (hardCap < step) {
            return 0;
        }

        int wanted = Math.max(1, desiredQty);
        long snapped = (((long) wanted + step - 1) / step) * step;
        if (snapped > hardCap) {
            snapped = ((long) hardCap / step) * step;
        }
        return snapped >= step ? (int) snapped : 0;
    }

    public int effectiveMoq(Product product) {
        Integer override = product.getMinOrderQtyOverride();
        if (override != null && override >= 1) {
            return override;
        }
        OrderflowProperties.Quantity quantity = properties.getQuantity();
        if (product.getCategory() != null) {
            Integer categoryMoq = quantity.getCategoryMoq().get(product.getCategory());
            if (categoryMoq != null && categoryMoq >= 1) {
                return categoryMoq;
            }
        }
        return Math.max(1, quantity.getDefaultMoq());
    }

    // rejects, never clamps
    public void requireAutoCheckout(int desiredQty) {
        int threshold = properties.getQuantity().getManualSalesThreshold();
        if (desiredQty > threshold) {
            throw new ManualChannelRequiredException(desiredQty, threshold);
        }
    }

    public int resolveLine(Product product, int desiredQty) {
        requireAutoCheckout(desiredQty);

        int moq = effectiveMoq(product);
        int globalMax = properties.getQuantity().getGlobalMax();
        int stock = product.getStockQuantity() != null ? product.getStockQuantity() : 0;
        int resolved = resolve(desiredQty, moq, stock, globalMax);

        if (resolved == 0) {
            log.warn("Line unsatisfiable: productId={}, desired={}, moq={}, stock={}",
                    product.getId(), desiredQty, moq, stock);
            throw new QuantityUnsatisfiableException(product.getId(), product.getName(), moq,
                    Math.min(Math.max(0, stock), globalMax));
        }
        if (resolved != desiredQty) {
            log.debug("Quantity adjusted: productId={}, desired={}, resolved={}, moq={}",
                    product.getId(), desiredQty, resolved, moq);
        }
        return resolved;
    }
}
