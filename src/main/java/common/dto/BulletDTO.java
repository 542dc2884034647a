package common.dto;

public record BulletDTO(double x, double y, double dx, double dy) {}
