package common.dto;

public record ChaserDTO(int id, double x, double y, double angle, double speed, int health) {}
