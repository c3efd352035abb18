package quest.gekko.bidopt.domain;

public record AdAccount(String id, String name, String currency, String status, String type) {}
