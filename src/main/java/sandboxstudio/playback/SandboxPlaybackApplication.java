package sandboxstudio.playback;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SandboxPlaybackApplication {

    public static void main(String[] args) {
        SpringApplication.run(SandboxPlaybackApplication.class, args);
    }
}
