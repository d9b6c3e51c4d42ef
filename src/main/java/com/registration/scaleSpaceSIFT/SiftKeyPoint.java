package com.registration.scaleSpaceSIFT;

public class SiftKeyPoint {
    public float x, y;          // Tọa độ trên ảnh gốc
    public int octave;          // Thuộc octave nào
    public int layer;           // Layer trong octave
    public float scale;         // Scale thực tế (sigma) trên ảnh gốc
    public float octaveScale;   // Sigma trong octave hiện tại
    public float octaveX, octaveY; // Tọa độ trong octave
    public float angle;         // Hướng (degree 0-360)
    public float response;      // |DoG| sau nội suy
    public float[] descriptor;  // Vector 128 chiều

    public SiftKeyPoint(float x, float y, int octave, int layer, float scale, float octaveScale, float response) {
        this.x = x;
        this.y = y;
        this.octave = octave;
        this.layer = layer;
        this.scale = scale;
        this.octaveScale = octaveScale;
        this.response = response;
        this.descriptor = new float[SiftConfig.DESCRIPTOR_LENGTH];
    }
}
