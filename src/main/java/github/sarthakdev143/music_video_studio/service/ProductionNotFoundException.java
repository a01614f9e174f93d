package github.sarthakdev143.music_video_studio.service;

public class ProductionNotFoundException extends RuntimeException {

    public ProductionNotFoundException(String productionId) {
        super("Production not found for id: " + productionId);
    }
}
