package teranet.mapdev.forge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TransformForgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(TransformForgeApplication.class, args);
    }
}
