package gridcast.marketdata.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot entry point wiring the market data transformation services.
 */
@SpringBootApplication
public class MarketDataTransformApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketDataTransformApplication.class, args);
    }
}
