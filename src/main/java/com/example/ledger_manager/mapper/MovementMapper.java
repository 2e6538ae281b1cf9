package com.example.ledger_manager.mapper;

import com.example.ledger_manager.dto.MovementView;
import com.example.ledger_manager.entity.Movement;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

import java.util.List;

@Mapper(componentModel = "spring")
public interface MovementMapper {

    // id is assigned by the database on insert
    @Mapping(target = "id", ignore = true)
    Movement toMovement(MovementParams params);

    MovementView toView(Movement movement);

    List<MovementView> toViews(List<Movement> movements);
}
