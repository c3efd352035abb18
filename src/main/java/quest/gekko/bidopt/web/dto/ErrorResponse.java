package quest.gekko.bidopt.web.dto;

public record ErrorResponse(String error, String category, Object details) {}
