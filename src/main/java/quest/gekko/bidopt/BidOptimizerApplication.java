package quest.gekko.bidopt;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BidOptimizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BidOptimizerApplication.class, args);
    }

}
