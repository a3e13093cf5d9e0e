package com.wmskiosk.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dispositivo lector tal como aparece al enumerar (HID o serial).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReaderDeviceInfo {

    /** Vendor ID USB */
    private int vendorId;

    /** Product ID USB */
    private int productId;

    /** Nombre de producto reportado por el dispositivo */
    private String productName;

    private String manufacturer;

    /** Ruta del sistema (ruta HID o nombre de puerto serial) */
    private String path;

    public boolean matches(int vendorId, int productId) {
        return this.vendorId == vendorId && this.productId == productId;
    }

    public String describe() {
        return String.format("VID: 0x%04X, PID: 0x%04X - %s %s",
                vendorId, productId,
                manufacturer != null ? manufacturer : "Unknown",
                productName != null ? productName : "Unknown");
    }
}
