package org.bella.dto;

import java.util.ArrayList;
import java.util.List;

public class NodeDTO
{
	public String kind;
	public String name;
	public String op;
	public Object value;
	public Boolean readOnly;
	public Integer paramCount;
	public Boolean userDefined;
	public List<NodeDTO> children = new ArrayList<>();
}
