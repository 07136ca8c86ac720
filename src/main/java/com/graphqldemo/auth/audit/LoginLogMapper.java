package com.graphqldemo.auth.audit;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface LoginLogMapper {

    void insert(LoginLog log);

    List<LoginLog> listByIdentifier(@Param("identifier") String identifier);
}
