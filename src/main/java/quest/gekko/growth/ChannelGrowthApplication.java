package quest.gekko.growth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ChannelGrowthApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChannelGrowthApplication.class, args);
    }

}
