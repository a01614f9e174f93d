package github.sarthakdev143.music_video_studio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MusicVideoStudioApplication {

	public static void main(String[] args) {
		SpringApplication.run(MusicVideoStudioApplication.class, args);
	}

}
