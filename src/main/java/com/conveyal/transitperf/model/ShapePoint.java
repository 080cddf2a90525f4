package com.conveyal.transitperf.model;

public class ShapePoint extends Entity {

    private static final long serialVersionUID = 6751814959971086070L;
    public String shape_id;
    public double shape_pt_lat;
    public double shape_pt_lon;
    public int    shape_pt_sequence;

    public ShapePoint () { }

    public ShapePoint (String shape_id, double shape_pt_lat, double shape_pt_lon, int shape_pt_sequence) {
        this.shape_id = shape_id;
        this.shape_pt_lat = shape_pt_lat;
        this.shape_pt_lon = shape_pt_lon;
        this.shape_pt_sequence = shape_pt_sequence;
    }

    @Override
    public String getId () {
        return shape_id;
    }

}
