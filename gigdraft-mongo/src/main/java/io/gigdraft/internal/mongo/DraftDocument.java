package io.gigdraft.internal.mongo;

import io.gigdraft.core.DurationUnit;
import io.gigdraft.core.SalaryUnit;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for scratch drafts.
 */
@Document(collection = "job_drafts")
public class DraftDocument {

    @Id
    private String id;

    private String title;
    private String description;

    private double salaryAmount;
    private SalaryUnit salaryUnit;
    private int durationAmount;
    private DurationUnit durationUnit;

    private Map<String, Object> location;
    private Instant lastModified;

    public DraftDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public double getSalaryAmount() {
        return salaryAmount;
    }

    public void setSalaryAmount(double salaryAmount) {
        this.salaryAmount = salaryAmount;
    }

    public SalaryUnit getSalaryUnit() {
        return salaryUnit;
    }

    public void setSalaryUnit(SalaryUnit salaryUnit) {
        this.salaryUnit = salaryUnit;
    }

    public int getDurationAmount() {
        return durationAmount;
    }

    public void setDurationAmount(int durationAmount) {
        this.durationAmount = durationAmount;
    }

    public DurationUnit getDurationUnit() {
        return durationUnit;
    }

    public void setDurationUnit(DurationUnit durationUnit) {
        this.durationUnit = durationUnit;
    }

    public Map<String, Object> getLocation() {
        return location;
    }

    public void setLocation(Map<String, Object> location) {
        this.location = location;
    }

    public Instant getLastModified() {
        return lastModified;
    }

    public void setLastModified(Instant lastModified) {
        this.lastModified = lastModified;
    }
}
