package dev.hrats.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Entity
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "settings")
public class Setting {

    public static final String DEFAULT_STATUS = "default_status";

    @Id
    @Column(name = "`key`", nullable = false)
    private String key;

    @Column(name = "`value`")
    private String value;
}
