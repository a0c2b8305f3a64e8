package dev.pekelund.loyalty.scanner;

import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

@ConfigurationProperties(prefix = "loyalty.receipt")
public class ReceiptScanProperties {

    /**
     * Restaurant name the vision model checks the receipt heading against.
     */
    private String vendorName = "Dumpling House";

    /**
     * Text printed next to the order number box, used to locate it on the receipt.
     */
    private String orderNumberAnchor = "Walk In";

    /**
     * Upper bound for one extraction call, including the Gemini round trip.
     */
    private Duration extractionTimeout = Duration.ofSeconds(30);

    /**
     * Threads available for extraction calls. Each submission uses two.
     */
    private int extractionPoolSize = 8;

    /**
     * Largest image accepted by the submission endpoint.
     */
    private DataSize maxImageSize = DataSize.ofMegabytes(10);

    /**
     * Receipts one submitter can earn points for per day. Zero or less disables the limit.
     */
    private int dailyReceiptLimit = 3;

    /**
     * Time zone in which receipt dates are compared with the current date and accepted receipts are counted per day.
     */
    private ZoneId zoneId = ZoneId.of("America/Chicago");

    public String getVendorName() {
        return vendorName;
    }

    public void setVendorName(String vendorName) {
        this.vendorName = vendorName;
    }

    public String getOrderNumberAnchor() {
        return orderNumberAnchor;
    }

    public void setOrderNumberAnchor(String orderNumberAnchor) {
        this.orderNumberAnchor = orderNumberAnchor;
    }

    public Duration getExtractionTimeout() {
        return extractionTimeout;
    }

    public void setExtractionTimeout(Duration extractionTimeout) {
        this.extractionTimeout = extractionTimeout;
    }

    public int getExtractionPoolSize() {
        return extractionPoolSize;
    }

    public void setExtractionPoolSize(int extractionPoolSize) {
        this.extractionPoolSize = extractionPoolSize;
    }

    public DataSize getMaxImageSize() {
        return maxImageSize;
    }

    public void setMaxImageSize(DataSize maxImageSize) {
        this.maxImageSize = maxImageSize;
    }

    public int getDailyReceiptLimit() {
        return dailyReceiptLimit;
    }

    public void setDailyReceiptLimit(int dailyReceiptLimit) {
        this.dailyReceiptLimit = dailyReceiptLimit;
    }

    public ZoneId getZoneId() {
        return zoneId;
    }

    public void setZoneId(ZoneId zoneId) {
        this.zoneId = zoneId;
    }
}
