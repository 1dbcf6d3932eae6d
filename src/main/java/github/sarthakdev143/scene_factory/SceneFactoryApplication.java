package github.sarthakdev143.scene_factory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SceneFactoryApplication {

	public static void main(String[] args) {
		SpringApplication.run(SceneFactoryApplication.class, args);
	}

}
