package ch.animalgame;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the animal game engine.
 *
 * <p>Enables Spring Boot auto-configuration and component scanning, which registers
 * {@link ch.animalgame.animalgameengine.service.MoveValidator} and
 * {@link ch.animalgame.animalgameengine.service.GameService}.
 */
@SpringBootApplication
public class AnimalGameApplication {

    public static void main(String[] args) {
        SpringApplication.run(AnimalGameApplication.class, args);
    }

}
