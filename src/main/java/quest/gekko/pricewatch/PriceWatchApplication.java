package quest.gekko.pricewatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PriceWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(PriceWatchApplication.class, args);
    }

}
