package quest.gekko.pricewatch.web.dto;

public record JobView(String name, String cron, boolean running) {}
